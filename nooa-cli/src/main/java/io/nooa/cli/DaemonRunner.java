package io.nooa.cli;

@FunctionalInterface
public interface DaemonRunner {
    int run() throws Exception;
}
