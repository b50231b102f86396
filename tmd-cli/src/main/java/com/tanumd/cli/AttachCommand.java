package com.tanumd.cli;

import com.tanumd.core.config.TmdConfig;
import com.tanumd.core.document.TmdDocument;
import com.tanumd.core.error.AttachmentException;
import com.tanumd.core.error.AttachmentException.Reason;
import com.tanumd.core.model.AttachmentMeta;
import com.tanumd.core.util.MimeTypes;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Commands to manage attachments. The document is rewritten in place in its own form.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * tmd attach add report.tmd photo.png --path images/photo.png
 * tmd attach mv report.tmd images/photo.png images/cover.png
 * tmd attach rm report.tmd images/cover.png
 * }</pre>
 */
@Command(
    name = "attach",
    description = "Add, remove or rename attachments",
    mixinStandardHelpOptions = true,
    subcommands = {
        AttachCommand.Add.class,
        AttachCommand.Remove.class,
        AttachCommand.Rename.class
    }
)
public class AttachCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * Adds a file as an attachment.
     */
    @Command(name = "add", description = "Add a file as an attachment", mixinStandardHelpOptions = true)
    public static class Add extends DocumentCommand {

        @Parameters(index = "0", description = "Document to modify")
        private Path document;

        @Parameters(index = "1", description = "File to attach")
        private Path file;

        @Option(names = "--path", description = "Logical path (default: images/ or data/ plus the file name)")
        private String logicalPath;

        @Option(names = "--mime", description = "Media type (default: guessed from the file)")
        private String mime;

        @Option(names = "--cover", description = "Use the attachment as cover image")
        private boolean cover;

        @Override
        protected void execute() throws Exception {
            TmdConfig cfg = config.load();
            String mediaType = mime != null ? mime : MimeTypes.probe(file);
            String path = logicalPath != null ? logicalPath : defaultPath(file, mediaType);
            try (TmdDocument doc = DocumentIO.load(document, cfg)) {
                UUID id = doc.addAttachment(path, mediaType, Files.readAllBytes(file));
                if (cover) {
                    doc.setCoverImage(id);
                }
                DocumentIO.save(doc, document, cfg);
                AttachmentMeta meta = doc.attachment(id).orElseThrow();
                out().println("✓ Added " + meta.logicalPath() + " (" + meta.length() + " bytes, " + meta.mime() + ")");
            }
        }

        static String defaultPath(Path file, String mediaType) {
            String folder = mediaType.startsWith("image/") ? "images/" : "data/";
            return folder + file.getFileName();
        }
    }

    /**
     * Removes an attachment by logical path.
     */
    @Command(name = "rm", description = "Remove an attachment", mixinStandardHelpOptions = true)
    public static class Remove extends DocumentCommand {

        @Parameters(index = "0", description = "Document to modify")
        private Path document;

        @Parameters(index = "1", description = "Logical path of the attachment")
        private String logicalPath;

        @Override
        protected void execute() throws Exception {
            TmdConfig cfg = config.load();
            try (TmdDocument doc = DocumentIO.load(document, cfg)) {
                AttachmentMeta meta = require(doc, logicalPath);
                doc.removeAttachment(meta.id());
                DocumentIO.save(doc, document, cfg);
                out().println("✓ Removed " + meta.logicalPath());
            }
        }
    }

    /**
     * Moves an attachment to a new logical path.
     */
    @Command(name = "mv", description = "Rename an attachment", mixinStandardHelpOptions = true)
    public static class Rename extends DocumentCommand {

        @Parameters(index = "0", description = "Document to modify")
        private Path document;

        @Parameters(index = "1", description = "Current logical path")
        private String from;

        @Parameters(index = "2", description = "New logical path")
        private String to;

        @Override
        protected void execute() throws Exception {
            TmdConfig cfg = config.load();
            try (TmdDocument doc = DocumentIO.load(document, cfg)) {
                AttachmentMeta meta = require(doc, from);
                AttachmentMeta renamed = doc.renameAttachment(meta.id(), to);
                DocumentIO.save(doc, document, cfg);
                out().println("✓ Renamed " + meta.logicalPath() + " to " + renamed.logicalPath());
            }
        }
    }

    private static AttachmentMeta require(TmdDocument doc, String logicalPath) {
        return doc.attachmentByPath(logicalPath)
            .orElseThrow(() -> new AttachmentException(Reason.NOT_FOUND,
                "attachment `" + logicalPath + "` not found"));
    }
}
