package io.gamevault.state;

import io.gamevault.state.cli.GameStateCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = GameStateCommand.commandLine().execute(args);
        System.exit(code);
    }
}
