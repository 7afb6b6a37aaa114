package io.engram.cli;

import picocli.CommandLine.Command;

@Command(name = "buffer", mixinStandardHelpOptions = true, description = "Manage the offline write buffer")
public final class BufferCommand implements Runnable {

    @Override
    public void run() {
        // Group command only shows help when no subcommand is provided.
    }
}
