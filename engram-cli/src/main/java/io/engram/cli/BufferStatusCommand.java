package io.engram.cli;

import io.engram.core.buffer.OfflineBuffer;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show the offline buffer location and size")
public final class BufferStatusCommand implements Callable<Integer> {
    private final CliContext context;

    public BufferStatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OfflineBuffer buffer = context.services().open().buffer();
            System.out.println("Buffer file: " + buffer.path());
            System.out.println("Buffered memories: " + buffer.count());
            return 0;
        } catch (Exception e) {
            System.err.println("Buffer status failed: " + e.getMessage());
            return 1;
        }
    }
}
