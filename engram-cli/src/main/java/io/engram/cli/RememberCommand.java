package io.engram.cli;

import io.engram.core.buffer.WriteOutcome;
import io.engram.core.memory.MemoryDomain;
import io.engram.core.memory.MemoryType;
import io.engram.core.memory.RememberRequest;
import io.engram.core.memory.TemporalLayer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "remember", description = "Store a memory, buffering it offline if the store is unavailable")
public final class RememberCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", paramLabel = "CONTENT", description = "Memory content")
    String content;

    @Option(names = {"-a", "--agent"}, description = "Agent name (defaults to the configured agent)")
    String agent;

    @Option(names = {"-t", "--tags"}, split = ",", description = "Comma-separated tags")
    List<String> tags = new ArrayList<>();

    @Option(names = {"-i", "--importance"}, description = "Importance score in [0, 1]")
    Double importance;

    @Option(names = "--type", description = "Memory type: facts, experiences, skills, preferences, decisions, context")
    String memoryType;

    @Option(names = {"-l", "--layer"}, description = "Temporal layer: working, short, long, archive")
    String layer;

    @Option(names = "--ttl-hours", description = "Working-memory time to live in hours")
    Double ttlHours;

    @Option(names = {"-d", "--domain"}, description = "Domain: self, user, projects, world, system, general")
    String domain;

    @Option(names = "--source", description = "Source type recorded with the memory")
    String source;

    public RememberCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RememberRequest request = RememberRequest.of(content, agent)
                .withTags(tags)
                .withSourceType(source)
                .withTtlHours(ttlHours);
            if (importance != null) {
                request = request.withImportance(importance);
            }
            if (memoryType != null) {
                request = request.withMemoryType(MemoryType.fromWire(memoryType));
            }
            if (layer != null) {
                request = request.withTemporalLayer(TemporalLayer.fromWire(layer));
            }
            if (domain != null) {
                request = request.withDomain(MemoryDomain.fromWire(domain));
            }

            WriteOutcome outcome = context.services().open().writer().write(request);
            if (outcome.isBuffered()) {
                System.out.println("Store unavailable, memory buffered for later sync");
            } else {
                System.out.println("Stored memory " + outcome.memoryId());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Remember failed: " + e.getMessage());
            return 1;
        }
    }
}
