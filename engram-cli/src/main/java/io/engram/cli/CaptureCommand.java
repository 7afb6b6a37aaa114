package io.engram.cli;

import io.engram.core.buffer.BufferedMemory;
import io.engram.core.buffer.CaptureType;
import io.engram.core.memory.MemoryDomain;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "capture", description = "Record an agent event as a short-lived working memory in the offline buffer")
public final class CaptureCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", paramLabel = "TYPE",
        description = "learning, decision, error, user_feedback, analysis, tool_use, file_read, file_write, "
            + "task_complete, question or milestone")
    String type;

    @Parameters(index = "1", paramLabel = "CONTENT", description = "What happened")
    String content;

    @Option(names = "--ttl-hours", description = "Override the event type's default time to live")
    Double ttlHours;

    @Option(names = {"-d", "--domain"}, description = "Override the event type's default domain")
    String domain;

    @Option(names = {"-t", "--tags"}, split = ",", description = "Extra comma-separated tags")
    List<String> tags = new ArrayList<>();

    public CaptureCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            BufferedMemory captured = context.services().open().capture().capture(
                CaptureType.fromWire(type),
                content,
                Map.of(),
                ttlHours,
                domain == null ? null : MemoryDomain.fromWire(domain),
                tags
            );
            System.out.println("Captured " + String.join(",", captured.tags()) + " for "
                + captured.ttlHours() + "h in " + captured.domain().wireName());
            return 0;
        } catch (Exception e) {
            System.err.println("Capture failed: " + e.getMessage());
            return 1;
        }
    }
}
