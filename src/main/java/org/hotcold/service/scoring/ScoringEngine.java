package org.hotcold.service.scoring;

import lombok.RequiredArgsConstructor;
import org.hotcold.exception.InvalidGuessFormatException;
import org.hotcold.model.Hint;
import org.hotcold.service.pricing.PricingService;
import org.springframework.stereotype.Service;

/**
 * Bulls and cows over fixed-width 12-digit numerals, plus the numeric distance.
 */
@Service
@RequiredArgsConstructor
public class ScoringEngine {

    public static final int WIDTH = 12;

    private final PricingService pricing;

    public Hint score(String target, String guess) {
        requireNumeral(target, "target");
        requireNumeral(guess, "guess");

        char[] targetLeft = target.toCharArray();
        char[] guessLeft = guess.toCharArray();

        // bulls: une seule passe, positions consommées des deux côtés
        int bulls = 0;
        for (int i = 0; i < WIDTH; i++) {
            if (targetLeft[i] == guessLeft[i]) {
                bulls++;
                targetLeft[i] = 0;
                guessLeft[i] = 0;
            }
        }

        // cows: chaque chiffre restant du guess prend la première occurrence libre du target
        int cows = 0;
        for (int i = 0; i < WIDTH; i++) {
            char g = guessLeft[i];
            if (g == 0) continue;
            for (int j = 0; j < WIDTH; j++) {
                if (targetLeft[j] == g) {
                    cows++;
                    targetLeft[j] = 0;
                    break;
                }
            }
        }

        long distance = Math.abs(Long.parseLong(target) - Long.parseLong(guess));
        return new Hint(bulls, cows, distance, bulls == WIDTH, pricing.tierFor(distance));
    }

    public static boolean isNumeral(String value) {
        if (value == null || value.length() != WIDTH) return false;
        for (int i = 0; i < WIDTH; i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }

    private static void requireNumeral(String value, String field) {
        if (!isNumeral(value)) {
            throw new InvalidGuessFormatException(field + " must be exactly " + WIDTH + " digits", field);
        }
    }
}
