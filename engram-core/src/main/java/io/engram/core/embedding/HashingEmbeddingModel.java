package io.engram.core.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Local feature-hashing embedding: lowercase alphanumeric tokens minus stop words, hashed into a
 * fixed number of buckets and L2-normalised. Deterministic and offline; lexical rather than semantic.
 */
public final class HashingEmbeddingModel implements EmbeddingModel {
    public static final int DEFAULT_DIMENSIONS = 256;

    private final int dimensions;

    public HashingEmbeddingModel() {
        this(DEFAULT_DIMENSIONS);
    }

    public HashingEmbeddingModel(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be > 0");
        }
        this.dimensions = dimensions;
    }

    @Override
    public String name() {
        return "hashing-" + dimensions;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public List<Double> embed(String text) {
        double[] vector = new double[dimensions];
        for (String token : tokenize(text)) {
            int index = Math.floorMod(token.hashCode(), dimensions);
            vector[index] += 1.0;
        }
        return VectorMath.normalize(vector);
    }

    private List<String> tokenize(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                out.add(token);
            }
        }
        return out;
    }

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "is", "are", "was", "were", "to", "of", "in", "for", "on", "with",
        "at", "by", "from", "it", "this", "that", "these", "those", "be", "been", "being", "as", "if", "but",
        "not", "no", "you", "your", "we", "our", "they", "their", "he", "she", "his", "her"
    );
}
