package io.markwise.cli;

import picocli.CommandLine.Command;

@Command(name = "markwise", mixinStandardHelpOptions = true, description = "Markwise assessment grading service")
public final class MarkwiseCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
