package com.tanumd.cli;

import com.tanumd.core.config.TmdConfig;
import com.tanumd.core.document.TmdDocument;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * Command to unpack a document into a workspace directory or another container layout.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * tmd unpack report.tmd report/        # directory
 * tmd unpack report.tmd report.tmdz    # plain archive
 * }</pre>
 */
@Command(
    name = "unpack",
    description = "Unpack a document into a directory, .tmd or .tmdz",
    mixinStandardHelpOptions = true
)
public class UnpackCommand extends DocumentCommand {

    @Parameters(index = "0", description = "Document to unpack")
    private Path input;

    @Parameters(index = "1", description = "Output directory or container file")
    private Path output;

    @Override
    protected void execute() throws Exception {
        TmdConfig cfg = config.load();
        try (TmdDocument doc = DocumentIO.load(input, cfg)) {
            DocumentIO.save(doc, output, cfg);
            out().println("✓ Unpacked " + input + " into " + output);
        }
    }
}
