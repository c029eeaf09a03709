package de.bsommerfeld.widgetd.daemon;

import de.bsommerfeld.widgetd.daemon.cli.WidgetdCommand;
import picocli.CommandLine;

public final class WidgetdMain {

    private WidgetdMain() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new WidgetdCommand()).execute(args);
        System.exit(code);
    }
}
