package dev.shortcuts;

import dev.shortcuts.cli.ShortcutIrCli;

import java.util.Arrays;

public class Main {
    public static void main(String[] args) {
        // must be set before the first logger is created
        if (Arrays.asList(args).contains("--verbose")) {
            System.setProperty("shortcut.ir.log.level", "debug");
        }
        int exitCode = ShortcutIrCli.commandLine().execute(args);
        System.exit(exitCode);
    }
}
