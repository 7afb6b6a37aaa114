package io.engram.core.embedding;

import java.io.IOException;
import java.util.List;

public interface EmbeddingModel {
    String name();

    int dimensions();

    List<Double> embed(String text) throws IOException;
}
