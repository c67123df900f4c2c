package de.bsommerfeld.mandump;

import de.bsommerfeld.mandump.cli.MandumpCommand;
import picocli.CommandLine;

/**
 * Command-line entry point.
 */
public final class MandumpMain {

    private MandumpMain() {}

    public static void main(String[] args) {
        System.exit(new CommandLine(new MandumpCommand()).execute(args));
    }
}
