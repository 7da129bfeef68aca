package org.hotcold.service;

import lombok.extern.slf4j.Slf4j;
import org.hotcold.crypto.Hashes;
import org.hotcold.crypto.SealService;
import org.hotcold.exception.InvalidBuyInException;
import org.hotcold.exception.InvalidGuessFormatException;
import org.hotcold.exception.InsufficientBuyInException;
import org.hotcold.exception.RoundNotActiveException;
import org.hotcold.exception.RoundNotFoundException;
import org.hotcold.model.GuessRecord;
import org.hotcold.model.Hint;
import org.hotcold.model.PriceTier;
import org.hotcold.model.Round;
import org.hotcold.model.RoundStatus;
import org.hotcold.model.attestation.SignedAuditRoot;
import org.hotcold.model.attestation.SignedHint;
import org.hotcold.model.attestation.SignedPriceUpdate;
import org.hotcold.model.attestation.SignedStartRound;
import org.hotcold.model.attestation.SignedWinnerDeclaration;
import org.hotcold.model.audit.AuditEntry;
import org.hotcold.model.audit.AuditPayload;
import org.hotcold.repo.RoundRepository;
import org.hotcold.service.attestation.AttestationService;
import org.hotcold.service.audit.AuditLedger;
import org.hotcold.service.pricing.PricingService;
import org.hotcold.service.scoring.ScoringEngine;
import org.hotcold.service.target.Target;
import org.hotcold.service.target.TargetGenerator;
import org.hotcold.service.util.Locks;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Owns round state and drives the ACTIVE → COMPLETED state machine.
 *
 * <p>Every guess runs under the round's monitor from the buy-in check to the last
 * signature: scoring, pricing escalation, winner detection, audit entries and
 * attestations. Signatures are produced before any state is touched, so a signer
 * failure leaves the round exactly as it was.
 */
@Slf4j
@Service
public class RoundService {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final BigInteger UINT256_MAX = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    private final RoundRepository rounds;
    private final TargetGenerator targets;
    private final SealService seal;
    private final ScoringEngine scoring;
    private final PricingService pricing;
    private final AuditLedger audit;
    private final AttestationService attestation;
    private final Locks locks;
    private final Clock clock;

    private volatile String activeRoundId;

    public RoundService(RoundRepository rounds,
                        TargetGenerator targets,
                        SealService seal,
                        ScoringEngine scoring,
                        PricingService pricing,
                        AuditLedger audit,
                        AttestationService attestation,
                        Locks locks,
                        Clock clock) {
        this.rounds = rounds;
        this.targets = targets;
        this.seal = seal;
        this.scoring = scoring;
        this.pricing = pricing;
        this.audit = audit;
        this.attestation = attestation;
        this.locks = locks;
        this.clock = clock;
    }

    public record StartedRound(Round round, SignedStartRound signedStartRound) {}

    public record GuessOutcome(Hint hint,
                               SignedHint signedHint,
                               SignedPriceUpdate priceUpdate,
                               SignedWinnerDeclaration winnerDeclaration) {}

    public record RoundSnapshot(String roundId,
                                RoundStatus status,
                                BigInteger currentBuyIn,
                                BigInteger pool,
                                int guessCount,
                                PriceTier priceTier,
                                String commitmentHash,
                                String winner) {}

    public record AuditReport(List<AuditEntry> entries, String merkleRoot, SignedAuditRoot signedMerkleRoot) {}

    public StartedRound start(BigInteger baseBuyIn) {
        if (baseBuyIn == null || baseBuyIn.signum() <= 0) {
            throw new InvalidBuyInException("baseBuyIn must be positive", "baseBuyIn");
        }
        // le buy-in le plus haut atteignable doit rester signable en uint256
        if (pricing.ceilingFor(baseBuyIn).compareTo(UINT256_MAX) > 0) {
            throw new InvalidBuyInException("baseBuyIn times the top tier multiplier exceeds uint256", "baseBuyIn");
        }
        String roundId = UUID.randomUUID().toString();
        Target target = targets.newRound(roundId);

        SignedStartRound signed = attestation.signStartRound(roundId, target.commitmentHash(), baseBuyIn);

        Round round = new Round(roundId, target.commitmentHash(), seal.seal(target.secret()), target.salt(),
                baseBuyIn, clock.millis());
        synchronized (locks.of(roundId)) {
            rounds.save(round);
            audit.append(roundId, new AuditPayload.RoundStart(target.commitmentHash(), baseBuyIn.toString()));
        }
        activeRoundId = roundId;
        log.info("Round {} started, commitment={}, baseBuyIn={}", roundId, target.commitmentHash(), baseBuyIn);
        return new StartedRound(round, signed);
    }

    public StartedRound start() {
        return start(pricing.defaultBaseBuyIn());
    }

    public GuessOutcome guess(String roundId, String player, String guess, BigInteger buyInPaid) {
        if (buyInPaid == null || buyInPaid.signum() < 0) {
            throw new InvalidBuyInException("buyInPaid must be a non-negative amount", "buyInPaid");
        }
        return play(roundId, player, guess, buyInPaid);
    }

    /** Guess paying exactly the round's buy-in as read under the round lock. */
    public GuessOutcome guessAtCurrentPrice(String roundId, String player, String guess) {
        return play(roundId, player, guess, null);
    }

    private GuessOutcome play(String roundId, String player, String guess, BigInteger paidOrNull) {
        if (player == null || !ADDRESS.matcher(player).matches()) {
            throw new InvalidGuessFormatException("player must be a 20-byte hex address", "player");
        }
        if (!ScoringEngine.isNumeral(guess)) {
            throw new InvalidGuessFormatException("guess must be exactly " + ScoringEngine.WIDTH + " digits", "guess");
        }
        Round round = rounds.findById(roundId).orElseThrow(() -> new RoundNotFoundException(roundId));

        synchronized (locks.of(roundId)) {
            if (!round.isActive()) throw new RoundNotActiveException(roundId, round.getStatus());
            BigInteger buyInPaid = paidOrNull != null ? paidOrNull : round.getCurrentBuyIn();
            if (buyInPaid.compareTo(round.getCurrentBuyIn()) < 0) {
                throw new InsufficientBuyInException(roundId, buyInPaid, round.getCurrentBuyIn());
            }

            Hint hint = scoring.score(seal.unseal(round.getSealedTarget()), guess);
            boolean escalate = pricing.shouldEscalate(round.getCurrentTier(), hint.numericDistance());
            BigInteger newBuyIn = escalate
                    ? pricing.buyInFor(round.getBaseBuyIn(), hint.numericDistance()).max(round.getCurrentBuyIn())
                    : null;

            // signatures d'abord : si le signer échoue, la manche reste intacte
            SignedHint signedHint = attestation.signHint(roundId, player,
                    hint.digitsCorrect(), hint.digitsInPlace(), hint.numericDistance());
            SignedPriceUpdate priceUpdate = escalate ? attestation.signPriceUpdate(roundId, newBuyIn) : null;
            SignedWinnerDeclaration winner = hint.exactMatch() ? attestation.signWinner(roundId, player) : null;

            long now = clock.millis();
            round.recordGuess(new GuessRecord(player, guess, hint, buyInPaid, now));
            audit.append(roundId, new AuditPayload.Guess(player, Hashes.keccakHex(guess), buyInPaid.toString()));
            audit.append(roundId, new AuditPayload.Hint(player, hint.digitsInPlace(), hint.digitsCorrect(),
                    Long.toString(hint.numericDistance())));
            log.debug("Round {} guess #{} by {}: bulls={}, cows={}", roundId, round.guessCount(), player,
                    hint.digitsInPlace(), hint.digitsCorrect());

            if (escalate) {
                round.escalate(hint.priceTier(), newBuyIn);
                audit.append(roundId, new AuditPayload.PriceChange(hint.priceTier().tag(), newBuyIn.toString()));
                log.info("Round {} escalated to {} (buy-in {})", roundId, hint.priceTier().tag(), newBuyIn);
            }

            if (hint.exactMatch()) {
                round.complete(player, now);
                audit.append(roundId, new AuditPayload.Winner(player));
                log.info("Round {} won by {} after {} guesses", roundId, player, round.guessCount());
            }

            return new GuessOutcome(hint, signedHint, priceUpdate, winner);
        }
    }

    public RoundSnapshot status(String roundId) {
        Round round = rounds.findById(roundId).orElseThrow(() -> new RoundNotFoundException(roundId));
        synchronized (locks.of(roundId)) {
            return new RoundSnapshot(round.getId(), round.getStatus(), round.getCurrentBuyIn(), round.getPool(),
                    round.guessCount(), round.getCurrentTier(), round.getCommitmentHash(), round.getWinner());
        }
    }

    /** Entries, Merkle root and a signed root anchor; an empty trail yields no root. */
    public AuditReport audit(String roundId) {
        rounds.findById(roundId).orElseThrow(() -> new RoundNotFoundException(roundId));
        synchronized (locks.of(roundId)) {
            List<AuditEntry> entries = audit.trail(roundId);
            if (entries.isEmpty()) return new AuditReport(entries, null, null);

            audit.requireIntact(roundId);
            String root = audit.merkleRoot(roundId);
            SignedAuditRoot anchor = attestation.signAuditRoot(roundId, root, entries.size());
            return new AuditReport(entries, root, anchor);
        }
    }

    public boolean verify(String roundId) {
        rounds.findById(roundId).orElseThrow(() -> new RoundNotFoundException(roundId));
        return audit.verifyChain(roundId);
    }

    public Optional<String> activeRoundId() {
        return Optional.ofNullable(activeRoundId);
    }
}
