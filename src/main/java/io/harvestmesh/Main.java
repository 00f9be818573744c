package io.harvestmesh;

import io.harvestmesh.cli.HarvestMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new HarvestMeshCommand()).execute(args);
        System.exit(code);
    }
}
