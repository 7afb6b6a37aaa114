package io.engram.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "clear", description = "Discard every buffered memory")
public final class BufferClearCommand implements Callable<Integer> {
    private final CliContext context;

    public BufferClearCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            context.services().open().buffer().clear();
            System.out.println("Buffer cleared.");
            return 0;
        } catch (Exception e) {
            System.err.println("Buffer clear failed: " + e.getMessage());
            return 1;
        }
    }
}
