package dev.sfc;

import dev.sfc.cli.SfcGraphCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SfcGraphCli()).execute(args);
        System.exit(exitCode);
    }
}
