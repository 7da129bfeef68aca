package org.hotcold.dto;

import org.hotcold.model.PriceTier;
import org.hotcold.model.attestation.SignedHint;
import org.hotcold.model.attestation.SignedPriceUpdate;
import org.hotcold.model.attestation.SignedWinnerDeclaration;

public class GuessResponse {
    public HintView hint;
    public SignedHint signedHint;
    public SignedPriceUpdate pricingUpdate;   // null si pas d'escalade
    public SignedWinnerDeclaration winner;    // null tant que personne n'a trouvé

    public GuessResponse() {}

    public GuessResponse(HintView hint, SignedHint signedHint, SignedPriceUpdate pricingUpdate, SignedWinnerDeclaration winner) {
        this.hint = hint;
        this.signedHint = signedHint;
        this.pricingUpdate = pricingUpdate;
        this.winner = winner;
    }

    public record HintView(int digitsInPlace, int digitsCorrect, String numericDistance, PriceTier priceTier) {}
}
