package io.nooa.core.daemon;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class DaemonEntrypoint {

    private DaemonEntrypoint() {
    }

    public static List<String> forMainClass(Class<?> mainClass, String... args) {
        String java = ProcessHandle.current().info().command()
            .orElse(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        List<String> command = new ArrayList<>();
        command.add(java);
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(mainClass.getName());
        command.addAll(List.of(args));
        return command;
    }
}
