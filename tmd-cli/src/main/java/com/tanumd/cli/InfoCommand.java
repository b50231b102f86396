package com.tanumd.cli;

import com.tanumd.core.document.TmdDocument;
import com.tanumd.core.model.AttachmentMeta;
import com.tanumd.core.model.LinkRef;
import com.tanumd.core.model.Manifest;
import com.tanumd.core.util.JsonSupport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.nio.file.Path;

/**
 * Command to show a document's manifest, attachments and database version.
 */
@Command(
    name = "info",
    description = "Show manifest, attachments and database version",
    mixinStandardHelpOptions = true
)
public class InfoCommand extends DocumentCommand {

    @Parameters(index = "0", description = "Document to inspect")
    private Path input;

    @Option(names = "--json", description = "Print the manifest as JSON")
    private boolean json;

    @Override
    protected void execute() throws Exception {
        try (TmdDocument doc = DocumentIO.load(input, config.load())) {
            PrintWriter out = out();
            Manifest manifest = doc.manifest();
            if (json) {
                out.println(JsonSupport.mapper().writeValueAsString(manifest));
                return;
            }
            out.println("Title:       " + (manifest.title() == null ? "(untitled)" : manifest.title()));
            out.println("Document id: " + manifest.docId());
            out.println("Version:     " + manifest.tmdVersion());
            out.println("Created:     " + manifest.createdUtc());
            out.println("Modified:    " + manifest.modifiedUtc());
            if (!manifest.authors().isEmpty()) {
                out.println("Authors:     " + String.join(", ", manifest.authors()));
            }
            if (!manifest.tags().isEmpty()) {
                out.println("Tags:        " + String.join(", ", manifest.tags()));
            }
            for (LinkRef link : manifest.links()) {
                out.println("Link:        " + link.rel() + " -> " + link.href());
            }
            if (manifest.coverImage() != null) {
                String cover = doc.attachment(manifest.coverImage().id())
                    .map(AttachmentMeta::logicalPath)
                    .orElse(manifest.coverImage().id().toString());
                out.println("Cover:       " + cover);
            }
            out.println("DB version:  " + doc.databaseVersion());
            out.println();
            out.println("Attachments (" + doc.attachments().size() + "):");
            for (AttachmentMeta meta : doc.attachments()) {
                out.printf("  %-40s %-24s %10d  %s%n",
                    meta.logicalPath(), meta.mime(), meta.length(), meta.sha256().substring(0, 12));
            }
        }
    }
}
