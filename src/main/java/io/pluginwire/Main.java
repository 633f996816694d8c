package io.pluginwire;

import io.pluginwire.cli.PluginWireCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PluginWireCommand()).execute(args);
        System.exit(code);
    }
}
