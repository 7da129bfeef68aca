package org.hotcold.dto;

import org.hotcold.model.PriceTier;
import org.hotcold.model.RoundStatus;

public class RoundStatusResponse {
    public String roundId;
    public RoundStatus status;
    public String currentBuyIn;
    public String pool;
    public int guessCount;
    public PriceTier priceTier;
    public String commitmentHash;
    public String winner;

    public RoundStatusResponse() {}

    public RoundStatusResponse(String roundId, RoundStatus status, String currentBuyIn, String pool,
                               int guessCount, PriceTier priceTier, String commitmentHash, String winner) {
        this.roundId = roundId;
        this.status = status;
        this.currentBuyIn = currentBuyIn;
        this.pool = pool;
        this.guessCount = guessCount;
        this.priceTier = priceTier;
        this.commitmentHash = commitmentHash;
        this.winner = winner;
    }
}
