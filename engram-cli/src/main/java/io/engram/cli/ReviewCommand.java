package io.engram.cli;

import picocli.CommandLine.Command;

@Command(name = "review", mixinStandardHelpOptions = true, description = "Inspect and decide the review backlog")
public final class ReviewCommand implements Runnable {

    @Override
    public void run() {
        // Group command only shows help when no subcommand is provided.
    }
}
