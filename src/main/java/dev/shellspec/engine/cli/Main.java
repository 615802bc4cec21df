package dev.shellspec.engine.cli;

import java.io.PrintStream;
import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine(System.out).execute(args));
    }

    static CommandLine commandLine(PrintStream out) {
        return new CommandLine(new ShellSpecCommand(out))
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
