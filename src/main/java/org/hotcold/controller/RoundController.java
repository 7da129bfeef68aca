package org.hotcold.controller;

import jakarta.validation.Valid;
import org.hotcold.dto.AuditResponse;
import org.hotcold.dto.GuessRequest;
import org.hotcold.dto.GuessResponse;
import org.hotcold.dto.RoundStatusResponse;
import org.hotcold.dto.StartRoundRequest;
import org.hotcold.dto.StartRoundResponse;
import org.hotcold.model.Hint;
import org.hotcold.service.RoundService;
import org.hotcold.service.RoundService.AuditReport;
import org.hotcold.service.RoundService.GuessOutcome;
import org.hotcold.service.RoundService.RoundSnapshot;
import org.hotcold.service.RoundService.StartedRound;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.Map;

@RestController
public class RoundController {

    private final RoundService roundService;

    public RoundController(RoundService roundService) {
        this.roundService = roundService;
    }

    @PostMapping("/round/start")
    public ResponseEntity<?> start(@Valid @RequestBody(required = false) StartRoundRequest req) {
        StartedRound started = (req == null || req.baseBuyIn == null)
                ? roundService.start()
                : roundService.start(new BigInteger(req.baseBuyIn));

        return ResponseEntity.ok(new StartRoundResponse(
                started.round().getId(),
                started.round().getCommitmentHash(),
                started.round().getBaseBuyIn().toString(),
                started.signedStartRound()));
    }

    @PostMapping("/guess")
    public ResponseEntity<?> guess(@Valid @RequestBody GuessRequest req) {
        // le paiement (txHash) est vérifié on-chain hors du cœur ; sans montant, buy-in courant lu sous verrou
        GuessOutcome outcome = req.buyInPaid != null
                ? roundService.guess(req.roundId, req.player, req.guess, new BigInteger(req.buyInPaid))
                : roundService.guessAtCurrentPrice(req.roundId, req.player, req.guess);
        Hint h = outcome.hint();
        return ResponseEntity.ok(new GuessResponse(
                new GuessResponse.HintView(h.digitsInPlace(), h.digitsCorrect(),
                        Long.toString(h.numericDistance()), h.priceTier()),
                outcome.signedHint(),
                outcome.priceUpdate(),
                outcome.winnerDeclaration()));
    }

    @GetMapping("/round/active")
    public ResponseEntity<?> active() {
        return roundService.activeRoundId()
                .<ResponseEntity<?>>map(id -> ResponseEntity.ok(Map.of("roundId", id)))
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of("error", "No round started yet")));
    }

    @GetMapping("/round/{id}/status")
    public ResponseEntity<?> status(@PathVariable String id) {
        RoundSnapshot s = roundService.status(id);
        return ResponseEntity.ok(new RoundStatusResponse(
                s.roundId(), s.status(), s.currentBuyIn().toString(), s.pool().toString(),
                s.guessCount(), s.priceTier(), s.commitmentHash(), s.winner()));
    }

    @GetMapping("/round/{id}/audit")
    public ResponseEntity<?> audit(@PathVariable String id) {
        AuditReport report = roundService.audit(id);
        return ResponseEntity.ok(new AuditResponse(report.entries(), report.merkleRoot(), report.signedMerkleRoot()));
    }

    @GetMapping("/round/{id}/verify")
    public ResponseEntity<?> verify(@PathVariable String id) {
        return ResponseEntity.ok(Map.of("roundId", id, "chainValid", roundService.verify(id)));
    }
}
