package io.engram.cli;

import io.engram.core.buffer.BufferSink;
import io.engram.core.buffer.SyncResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "sync", description = "Replay buffered memories to the memory service")
public final class BufferSyncCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--local", description = "Write directly to the local store instead of the HTTP endpoint")
    boolean local;

    public BufferSyncCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            EngramServices services = context.services().open();
            BufferSink sink = local ? services.localSink() : services.remoteSink();
            SyncResult result = services.buffer().sync(sink);
            System.out.println("Synced " + result.synced() + " via " + sink.name()
                + ", " + result.failed().size() + " still buffered");
            return result.failed().isEmpty() ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Buffer sync failed: " + e.getMessage());
            return 1;
        }
    }
}
