package io.cronrelay;

import io.cronrelay.cli.CronRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new CronRelayCommand()).execute(args);
        System.exit(code);
    }
}
