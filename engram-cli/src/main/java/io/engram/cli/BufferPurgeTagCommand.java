package io.engram.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "purge-tag", description = "Remove buffered memories carrying a tag")
public final class BufferPurgeTagCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", paramLabel = "TAG", description = "Tag to purge")
    String tag;

    public BufferPurgeTagCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            int removed = context.services().open().buffer().removeByTag(tag);
            System.out.println("Removed " + removed + " buffered memories tagged '" + tag + "'");
            return 0;
        } catch (Exception e) {
            System.err.println("Buffer purge failed: " + e.getMessage());
            return 1;
        }
    }
}
