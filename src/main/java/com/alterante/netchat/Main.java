package com.alterante.netchat;

import com.alterante.netchat.command.NodeCommand;
import picocli.CommandLine;

@CommandLine.Command(
        name = "netchat",
        description = "LAN peer-to-peer chat and file sharing",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                NodeCommand.class,
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
