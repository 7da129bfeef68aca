package org.hotcold.controller;

import org.hotcold.dto.GuessRequest;
import org.hotcold.dto.GuessResponse;
import org.hotcold.dto.RoundStatusResponse;
import org.hotcold.dto.StartRoundRequest;
import org.hotcold.dto.StartRoundResponse;
import org.hotcold.exception.RoundNotFoundException;
import org.hotcold.model.Hint;
import org.hotcold.model.PriceTier;
import org.hotcold.model.Round;
import org.hotcold.model.RoundStatus;
import org.hotcold.model.attestation.SignedHint;
import org.hotcold.model.attestation.SignedStartRound;
import org.hotcold.service.RoundService;
import org.hotcold.service.RoundService.GuessOutcome;
import org.hotcold.service.RoundService.RoundSnapshot;
import org.hotcold.service.RoundService.StartedRound;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoundControllerTest {

    private static final String ROUND = "round-1";
    private static final String PLAYER = "0x70997970C51812dc3A010C7d01b50e0d17dc79C8";
    private static final String TX = "0x" + "cd".repeat(32);
    private static final String COMMITMENT = "0x" + "ef".repeat(32);

    @Mock
    private RoundService roundService;

    @InjectMocks
    private RoundController roundController;

    private StartedRound started(BigInteger base) {
        Round r = new Round(ROUND, COMMITMENT, "iv:cipher", "0x" + "00".repeat(32), base, 1_000L);
        return new StartedRound(r, new SignedStartRound(ROUND, COMMITMENT, base.toString(), 0L, "0xsig"));
    }

    private RoundSnapshot snapshot(BigInteger buyIn) {
        return new RoundSnapshot(ROUND, RoundStatus.ACTIVE, buyIn, BigInteger.ZERO, 0, PriceTier.BASE, COMMITMENT, null);
    }

    private GuessOutcome miss() {
        Hint hint = new Hint(1, 2, 86_543_210_988L, false, PriceTier.BASE);
        SignedHint signed = new SignedHint(ROUND, PLAYER, 2, 1, "86543210988", 1L, "0xsig");
        return new GuessOutcome(hint, signed, null, null);
    }

    @Test
    void start_withoutBody_shouldUseDefaultBuyIn() {
        BigInteger base = new BigInteger("10000000000000000");
        when(roundService.start()).thenReturn(started(base));

        ResponseEntity<?> response = roundController.start(null);

        assertThat(response.getStatusCode().is2xxSuccessful()).isTrue();
        StartRoundResponse body = (StartRoundResponse) response.getBody();
        assertThat(body.roundId).isEqualTo(ROUND);
        assertThat(body.commitmentHash).isEqualTo(COMMITMENT);
        assertThat(body.baseBuyIn).isEqualTo("10000000000000000");
        assertThat(body.signedStartRound.nonce()).isZero();

        verify(roundService, never()).start(any(BigInteger.class));
    }

    @Test
    void start_withBuyIn_shouldParseWeiString() {
        BigInteger base = new BigInteger("250000000000000000000");
        when(roundService.start(base)).thenReturn(started(base));

        ResponseEntity<?> response = roundController.start(new StartRoundRequest("250000000000000000000"));

        assertThat(((StartRoundResponse) response.getBody()).baseBuyIn).isEqualTo("250000000000000000000");
        verify(roundService, never()).start();
    }

    @Test
    void guess_withExplicitPayment_shouldForwardIt() {
        when(roundService.guess(ROUND, PLAYER, "210000000000", new BigInteger("42"))).thenReturn(miss());

        ResponseEntity<?> response = roundController.guess(
                new GuessRequest(ROUND, "210000000000", PLAYER, TX, "42"));

        GuessResponse body = (GuessResponse) response.getBody();
        assertThat(body.hint.digitsInPlace()).isEqualTo(1);
        assertThat(body.hint.digitsCorrect()).isEqualTo(2);
        assertThat(body.hint.numericDistance()).isEqualTo("86543210988");
        assertThat(body.hint.priceTier()).isEqualTo(PriceTier.BASE);
        assertThat(body.signedHint.nonce()).isEqualTo(1L);
        assertThat(body.pricingUpdate).isNull();
        assertThat(body.winner).isNull();

        verify(roundService, never()).status(anyString());
        verify(roundService, never()).guessAtCurrentPrice(anyString(), anyString(), anyString());
    }

    @Test
    void guess_withoutPayment_shouldDelegateCurrentPriceToService() {
        when(roundService.guessAtCurrentPrice(ROUND, PLAYER, "210000000000")).thenReturn(miss());

        ResponseEntity<?> response = roundController.guess(
                new GuessRequest(ROUND, "210000000000", PLAYER, TX, null));

        assertThat(response.getStatusCode().is2xxSuccessful()).isTrue();
        verify(roundService).guessAtCurrentPrice(ROUND, PLAYER, "210000000000");
        verify(roundService, never()).status(anyString());
        verify(roundService, never()).guess(anyString(), anyString(), anyString(), any());
    }

    @Test
    void active_noRound_shouldReturn404() {
        when(roundService.activeRoundId()).thenReturn(Optional.empty());

        ResponseEntity<?> response = roundController.active();

        assertThat(response.getStatusCode().value()).isEqualTo(404);
        assertThat(response.getBody()).isEqualTo(Map.of("error", "No round started yet"));
    }

    @Test
    void active_shouldReturnLatestRoundId() {
        when(roundService.activeRoundId()).thenReturn(Optional.of(ROUND));

        ResponseEntity<?> response = roundController.active();

        assertThat(response.getBody()).isEqualTo(Map.of("roundId", ROUND));
    }

    @Test
    void status_shouldRenderAmountsAsDecimalStrings() {
        when(roundService.status(ROUND)).thenReturn(snapshot(new BigInteger("50000000000000000")));

        RoundStatusResponse body = (RoundStatusResponse) roundController.status(ROUND).getBody();

        assertThat(body.currentBuyIn).isEqualTo("50000000000000000");
        assertThat(body.pool).isEqualTo("0");
        assertThat(body.status).isEqualTo(RoundStatus.ACTIVE);
    }

    @Test
    void status_unknownRound_shouldPropagateNotFound() {
        when(roundService.status("nope")).thenThrow(new RoundNotFoundException("nope"));

        assertThatThrownBy(() -> roundController.status("nope")).isInstanceOf(RoundNotFoundException.class);
    }

    @Test
    void verify_shouldReportChainValidity() {
        when(roundService.verify(ROUND)).thenReturn(true);

        ResponseEntity<?> response = roundController.verify(ROUND);

        assertThat(response.getBody()).isEqualTo(Map.of("roundId", ROUND, "chainValid", true));
    }
}
