package com.tanumd.cli;

import com.tanumd.core.workspace.Workspace;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * Command to scaffold a new workspace directory.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * tmd new trip --title "Trip report"
 * }</pre>
 */
@Command(
    name = "new",
    description = "Scaffold a new TMD workspace directory",
    mixinStandardHelpOptions = true
)
public class NewCommand extends DocumentCommand {

    @Parameters(index = "0", description = "Directory to create")
    private Path path;

    @Option(names = "--title", description = "Document title")
    private String title;

    @Override
    protected void execute() throws Exception {
        Workspace.scaffold(path, title);
        out().println("✓ Initialized new TMD workspace at " + path);
    }
}
