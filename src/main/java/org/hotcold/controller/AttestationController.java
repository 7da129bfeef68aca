package org.hotcold.controller;

import org.hotcold.service.attestation.AttestationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AttestationController {

    private final AttestationService attestationService;

    public AttestationController(AttestationService attestationService) {
        this.attestationService = attestationService;
    }

    /** Address, uncompressed public key and mode (tee | simulation) of the enclave key. */
    @GetMapping("/attestation")
    public ResponseEntity<?> attestation() {
        return ResponseEntity.ok(attestationService.identity());
    }
}
