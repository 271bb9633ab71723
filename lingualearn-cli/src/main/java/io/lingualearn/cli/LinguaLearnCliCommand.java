package io.lingualearn.cli;

import picocli.CommandLine.Command;

@Command(name = "lingualearn", mixinStandardHelpOptions = true, description = "LinguaLearn agent hub")
public final class LinguaLearnCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
