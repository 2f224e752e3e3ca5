package io.taskmesh;

import io.taskmesh.cli.TaskMeshCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = TaskMeshCommand.commandLine().execute(args);
        System.exit(code);
    }
}
