package com.tanumd.cli;

import com.tanumd.core.codec.Format;
import com.tanumd.core.config.TmdConfig;
import com.tanumd.core.document.TmdDocument;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * Command to pack a workspace directory or container into a container file.
 *
 * <p>The output layout follows the extension; without a recognized extension the configured
 * default layout is used.
 */
@Command(
    name = "pack",
    description = "Pack a directory or container into a .tmd or .tmdz file",
    mixinStandardHelpOptions = true
)
public class PackCommand extends DocumentCommand {

    @Parameters(index = "0", description = "Workspace directory, .tmd or .tmdz file")
    private Path input;

    @Parameters(index = "1", description = "Output file")
    private Path output;

    @Override
    protected void execute() throws Exception {
        TmdConfig cfg = config.load();
        try (TmdDocument doc = DocumentIO.load(input, cfg)) {
            Format format = DocumentIO.pack(doc, output, cfg);
            out().println("✓ Packed " + input + " into " + output + " (" + format.extension() + ")");
        }
    }
}
