package io.engram.core.testing;

import io.engram.core.embedding.EmbeddingModel;
import io.engram.core.embedding.VectorMath;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps known words onto shared concept axes so related wording lands close together. Exact texts can be
 * pinned to a fixed vector when a test needs a precise similarity.
 */
public final class ConceptEmbeddingModel implements EmbeddingModel {
    private static final Map<String, Integer> LEXICON = Map.ofEntries(
        Map.entry("postgresql", 0),
        Map.entry("postgres", 0),
        Map.entry("database", 0),
        Map.entry("sql", 0),
        Map.entry("billing", 1),
        Map.entry("invoice", 1),
        Map.entry("payment", 1),
        Map.entry("decided", 2),
        Map.entry("chose", 2),
        Map.entry("pick", 2),
        Map.entry("picked", 2),
        Map.entry("deploy", 3),
        Map.entry("release", 3),
        Map.entry("friday", 3),
        Map.entry("lunch", 4),
        Map.entry("noon", 4)
    );

    private final Map<String, List<Double>> pinned = new HashMap<>();

    public ConceptEmbeddingModel pin(String text, List<Double> vector) {
        pinned.put(text, List.copyOf(vector));
        return this;
    }

    @Override
    public String name() {
        return "concept";
    }

    @Override
    public int dimensions() {
        return 5;
    }

    @Override
    public List<Double> embed(String text) {
        List<Double> fixed = pinned.get(text);
        if (fixed != null) {
            return fixed;
        }
        double[] vector = new double[dimensions()];
        for (String token : (text == null ? "" : text).toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            Integer axis = LEXICON.get(token);
            if (axis != null) {
                vector[axis] += 1.0;
            }
        }
        return VectorMath.normalize(vector);
    }
}
