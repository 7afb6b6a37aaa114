package io.engram.cli;

import java.io.IOException;

@FunctionalInterface
public interface ServicesProvider {
    EngramServices open() throws IOException;
}
