package org.hotcold.dto;

import jakarta.validation.constraints.Pattern;

public class StartRoundRequest {
    @Pattern(regexp = "^\\d+$", message = "baseBuyIn must be a numeric string (wei)")
    public String baseBuyIn; // optionnel : défaut de la config

    public StartRoundRequest() {}
    public StartRoundRequest(String baseBuyIn) { this.baseBuyIn = baseBuyIn; }
}
