package io.engram.cli;

import java.time.Duration;

@FunctionalInterface
public interface WorkerRunner {
    int run(Duration interval) throws Exception;
}
