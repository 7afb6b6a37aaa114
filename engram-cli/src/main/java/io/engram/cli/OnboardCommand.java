package io.engram.cli;

import io.engram.core.config.OnboardResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write the config file and prepare the store and buffer directories")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Reset an existing config to the defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            OnboardResult result = context.configService().onboard(context.configPath(), overwrite);
            String verb = switch (result.action()) {
                case CREATED -> "Created config";
                case OVERWRITTEN -> "Reset config to defaults";
                case REFRESHED -> "Added missing defaults to config";
            };
            System.out.println(verb + ": " + result.configPath());
            System.out.println("Memory store: " + result.storePath());
            System.out.println("Offline buffer: " + result.bufferPath());
            if (result.action() == OnboardResult.Action.CREATED) {
                System.out.println("Next: set providers.anthropic.apiKey (or ANTHROPIC_API_KEY) to enable sleep cycles");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }
    }
}
