package io.taskpatrol;

import io.taskpatrol.cli.TaskPatrolCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new TaskPatrolCommand()).execute(args);
        System.exit(code);
    }
}
