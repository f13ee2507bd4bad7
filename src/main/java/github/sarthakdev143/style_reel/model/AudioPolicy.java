package github.sarthakdev143.style_reel.model;

import java.util.Locale;

public enum AudioPolicy {
    SILENCE_PAD,
    LOOP;

    public static AudioPolicy fromInput(String input) {
        if (input == null || input.isBlank()) {
            return SILENCE_PAD;
        }

        try {
            return AudioPolicy.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("audioPolicy must be one of SILENCE_PAD, LOOP.");
        }
    }
}
