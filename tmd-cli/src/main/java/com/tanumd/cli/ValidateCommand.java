package com.tanumd.cli;

import com.tanumd.core.config.TmdConfig;
import com.tanumd.core.document.TmdDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * Command to validate a document.
 *
 * <p>Decoding checks the container structure; digests are always verified here regardless of
 * the configured read mode.
 */
@Command(
    name = "validate",
    description = "Validate a .tmd or .tmdz document",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends DocumentCommand {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Document to validate")
    private Path input;

    @Override
    protected void execute() throws Exception {
        TmdConfig loaded = config.load();
        TmdConfig strict = new TmdConfig(
            new TmdConfig.ReadConfig(true, false), loaded.write(), loaded.database());
        log.info("Validating {}", input);
        try (TmdDocument doc = DocumentIO.load(input, strict)) {
            int version = doc.databaseVersion();
            out().println("✓ " + input + " is valid");
            out().println("  doc_id:      " + doc.manifest().docId());
            out().println("  attachments: " + doc.attachments().size());
            out().println("  db version:  " + version);
        }
    }
}
