package com.tanumd.cli;

import com.tanumd.core.document.TmdDocument;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command to export a document as HTML.
 */
@Command(
    name = "export-html",
    description = "Export a document to HTML",
    mixinStandardHelpOptions = true
)
public class ExportHtmlCommand extends DocumentCommand {

    @Parameters(index = "0", description = "Document to export")
    private Path input;

    @Parameters(index = "1", description = "HTML file to write")
    private Path output;

    @Option(names = "--self-contained", description = "Embed attachments as data URIs")
    private boolean selfContained;

    @Override
    protected void execute() throws Exception {
        try (TmdDocument doc = DocumentIO.load(input, config.load())) {
            String html = new HtmlExporter(selfContained).render(doc);
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, html, StandardCharsets.UTF_8);
            out().println("✓ Exported " + input + " to HTML at " + output);
        }
    }
}
