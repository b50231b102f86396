package com.tanumd.cli;

import com.tanumd.core.config.TmdConfig;
import com.tanumd.core.document.TmdDocument;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Commands to manage the embedded database. Modifying commands rewrite the document in place.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * tmd db reset report.tmd --schema schema.sql --schema-version 1
 * tmd db migrate report.tmd --sql step2.sql --from 1 --to 2
 * tmd db export report.tmd data.sqlite3
 * tmd db import report.tmd data.sqlite3
 * }</pre>
 */
@Command(
    name = "db",
    description = "Export, import, reset or migrate the embedded database",
    mixinStandardHelpOptions = true,
    subcommands = {
        DbCommand.Export.class,
        DbCommand.Import.class,
        DbCommand.Reset.class,
        DbCommand.Migrate.class
    }
)
public class DbCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * Copies the database to a file.
     */
    @Command(name = "export", description = "Copy the database to a SQLite file", mixinStandardHelpOptions = true)
    public static class Export extends DocumentCommand {

        @Parameters(index = "0", description = "Document")
        private Path document;

        @Parameters(index = "1", description = "SQLite file to write")
        private Path target;

        @Override
        protected void execute() throws Exception {
            try (TmdDocument doc = DocumentIO.load(document, config.load())) {
                doc.exportDatabase(target);
                out().println("✓ Exported database (version " + doc.databaseVersion() + ") to " + target);
            }
        }
    }

    /**
     * Replaces the database with a file.
     */
    @Command(name = "import", description = "Replace the database with a SQLite file", mixinStandardHelpOptions = true)
    public static class Import extends DocumentCommand {

        @Parameters(index = "0", description = "Document to modify")
        private Path document;

        @Parameters(index = "1", description = "SQLite file to import")
        private Path source;

        @Override
        protected void execute() throws Exception {
            TmdConfig cfg = config.load();
            try (TmdDocument doc = DocumentIO.load(document, cfg)) {
                doc.importDatabase(source);
                DocumentIO.save(doc, document, cfg);
                out().println("✓ Imported " + source + " (version " + doc.databaseVersion() + ")");
            }
        }
    }

    /**
     * Drops all content and applies a schema.
     */
    @Command(name = "reset", description = "Drop all tables and apply a schema", mixinStandardHelpOptions = true)
    public static class Reset extends DocumentCommand {

        @Parameters(index = "0", description = "Document to modify")
        private Path document;

        @Option(names = "--schema", required = true, description = "File with schema SQL")
        private Path schema;

        @Option(names = "--schema-version", required = true, description = "Schema version to record")
        private int version;

        @Override
        protected void execute() throws Exception {
            TmdConfig cfg = config.load();
            String sql = Files.readString(schema);
            try (TmdDocument doc = DocumentIO.load(document, cfg)) {
                doc.resetDatabase(sql, version);
                DocumentIO.save(doc, document, cfg);
                out().println("✓ Database reset to version " + version);
            }
        }
    }

    /**
     * Applies one migration step.
     */
    @Command(name = "migrate", description = "Apply one schema migration step", mixinStandardHelpOptions = true)
    public static class Migrate extends DocumentCommand {

        @Parameters(index = "0", description = "Document to modify")
        private Path document;

        @Option(names = "--sql", required = true, description = "File with migration SQL")
        private Path step;

        @Option(names = "--from", required = true, description = "Expected current version")
        private int from;

        @Option(names = "--to", required = true, description = "Version after the step")
        private int to;

        @Override
        protected void execute() throws Exception {
            TmdConfig cfg = config.load();
            String sql = Files.readString(step);
            try (TmdDocument doc = DocumentIO.load(document, cfg)) {
                doc.migrateDatabase(sql, from, to);
                DocumentIO.save(doc, document, cfg);
                out().println("✓ Database migrated from version " + from + " to " + to);
            }
        }
    }
}
