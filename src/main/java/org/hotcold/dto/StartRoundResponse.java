package org.hotcold.dto;

import org.hotcold.model.attestation.SignedStartRound;

public class StartRoundResponse {
    public String roundId;
    public String commitmentHash;
    public String baseBuyIn;
    public SignedStartRound signedStartRound;

    public StartRoundResponse() {}

    public StartRoundResponse(String roundId, String commitmentHash, String baseBuyIn, SignedStartRound signedStartRound) {
        this.roundId = roundId;
        this.commitmentHash = commitmentHash;
        this.baseBuyIn = baseBuyIn;
        this.signedStartRound = signedStartRound;
    }
}
