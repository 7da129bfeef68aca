package org.hotcold.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public class GuessRequest {
    @NotBlank
    public String roundId;

    @NotNull
    @Pattern(regexp = "^\\d{12}$", message = "Guess must be exactly 12 digits")
    public String guess;

    @NotNull
    @Pattern(regexp = "^0x[a-fA-F0-9]{40}$", message = "Invalid Ethereum address")
    public String player;

    @NotNull
    @Pattern(regexp = "^0x[a-fA-F0-9]{64}$", message = "Invalid transaction hash")
    public String txHash; // preuve de paiement, vérifiée hors enclave

    @Pattern(regexp = "^\\d+$", message = "buyInPaid must be a numeric string (wei)")
    public String buyInPaid; // absent → buy-in courant de la manche

    public GuessRequest() {}

    public GuessRequest(String roundId, String guess, String player, String txHash, String buyInPaid) {
        this.roundId = roundId;
        this.guess = guess;
        this.player = player;
        this.txHash = txHash;
        this.buyInPaid = buyInPaid;
    }
}
