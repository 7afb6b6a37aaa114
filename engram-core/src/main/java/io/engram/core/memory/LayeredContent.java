package io.engram.core.memory;

import java.util.Arrays;

/**
 * Three progressively detailed views of a memory's content. Layers 1 and 2 are word-truncated
 * summaries that get embedded; layer 3 is the raw content capped for detail expansion.
 */
public record LayeredContent(String layer1, String layer2, String layer3) {
    public static final int LAYER1_WORDS = 10;
    public static final int LAYER2_WORDS = 50;
    public static final int LAYER3_CHARS = 2000;
    static final String ELLIPSIS = "...";

    public LayeredContent {
        layer1 = layer1 == null ? "" : layer1;
        layer2 = layer2 == null ? "" : layer2;
        layer3 = layer3 == null ? "" : layer3;
    }

    public static LayeredContent of(String content) {
        String safe = content == null ? "" : content;
        String[] words = safe.isBlank() ? new String[0] : safe.trim().split("\\s+");
        return new LayeredContent(
            firstWords(words, LAYER1_WORDS),
            firstWords(words, LAYER2_WORDS),
            safe.length() > LAYER3_CHARS ? safe.substring(0, LAYER3_CHARS) : safe
        );
    }

    public String atMost(int maxLayer) {
        if (maxLayer >= 3 && !layer3.isBlank()) {
            return layer3;
        }
        if (maxLayer >= 2 && !layer2.isBlank()) {
            return layer2;
        }
        return layer1;
    }

    private static String firstWords(String[] words, int max) {
        if (words.length <= max) {
            return String.join(" ", words);
        }
        return String.join(" ", Arrays.copyOfRange(words, 0, max)) + ELLIPSIS;
    }
}
