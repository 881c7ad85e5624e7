package io.huddle;

import io.huddle.cli.HuddleCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = HuddleCommand.newCommandLine(new HuddleCommand()).execute(args);
        System.exit(code);
    }
}
