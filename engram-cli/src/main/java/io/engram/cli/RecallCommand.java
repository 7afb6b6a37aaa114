package io.engram.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.engram.core.memory.MemoryDomain;
import io.engram.core.memory.MemoryType;
import io.engram.core.memory.RecallRequest;
import io.engram.core.memory.RecallResult;
import io.engram.core.memory.TemporalLayer;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "recall", description = "Search memories by meaning, weighted by temporal layer")
public final class RecallCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final CliContext context;

    @Parameters(index = "0", paramLabel = "QUERY", description = "Search query")
    String query;

    @Option(names = {"-a", "--agent"}, description = "Agent name (defaults to the configured agent)")
    String agent;

    @Option(names = {"-t", "--tags"}, split = ",", description = "Only memories carrying any of these tags")
    List<String> tags = new ArrayList<>();

    @Option(names = "--type", description = "Only memories of this type")
    String memoryType;

    @Option(names = {"-d", "--domain"}, description = "Only memories in this domain")
    String domain;

    @Option(names = "--layers", split = ",", description = "Restrict to these temporal layers")
    List<String> layers = new ArrayList<>();

    @Option(names = "--max-layer", description = "Content detail level 1-3 (default: ${DEFAULT-VALUE})")
    int maxLayer = RecallRequest.DEFAULT_MAX_LAYER;

    @Option(names = {"-n", "--limit"}, description = "Maximum results (default: ${DEFAULT-VALUE})")
    int limit = RecallRequest.DEFAULT_LIMIT;

    @Option(names = "--min-score", description = "Minimum weighted score (default: ${DEFAULT-VALUE})")
    double minScore = RecallRequest.DEFAULT_MIN_SCORE;

    @Option(names = "--include-archive", description = "Also search archived memories")
    boolean includeArchive;

    @Option(names = "--json", description = "Print results as JSON")
    boolean json;

    public RecallCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RecallRequest request = RecallRequest.of(query, agent)
                .withTags(tags)
                .withMaxLayer(maxLayer)
                .withLimit(limit)
                .withMinScore(minScore)
                .withIncludeArchive(includeArchive);
            if (memoryType != null) {
                request = request.withMemoryType(MemoryType.fromWire(memoryType));
            }
            if (domain != null) {
                request = request.withDomain(MemoryDomain.fromWire(domain));
            }
            if (!layers.isEmpty()) {
                Set<TemporalLayer> selected = EnumSet.noneOf(TemporalLayer.class);
                for (String layer : layers) {
                    selected.add(TemporalLayer.fromWire(layer));
                }
                request = request.withTemporalLayers(selected);
            }

            List<RecallResult> results = context.services().open().engine().recall(request);
            if (json) {
                System.out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(results));
                return 0;
            }
            if (results.isEmpty()) {
                System.out.println("No memories found.");
                return 0;
            }
            for (RecallResult result : results) {
                System.out.printf(Locale.ROOT, "#%d [%s/%s] %.3f %s%n",
                    result.id(),
                    result.temporalLayer().wireName(),
                    result.memoryType().wireName(),
                    result.similarity(),
                    result.content());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Recall failed: " + e.getMessage());
            return 1;
        }
    }
}
