package io.tagkeeper;

import io.tagkeeper.cli.TagKeeperCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = TagKeeperCommand.commandLine().execute(args);
        System.exit(code);
    }
}
