package com.tanumd;

import ch.qos.logback.classic.Level;
import com.tanumd.cli.AttachCommand;
import com.tanumd.cli.DbCommand;
import com.tanumd.cli.ExportHtmlCommand;
import com.tanumd.cli.InfoCommand;
import com.tanumd.cli.NewCommand;
import com.tanumd.cli.PackCommand;
import com.tanumd.cli.QueryCommand;
import com.tanumd.cli.UnpackCommand;
import com.tanumd.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for Tanu Markdown.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code new} - Scaffold a workspace directory</li>
 *   <li>{@code pack} - Pack a workspace or container into a {@code .tmd}/{@code .tmdz} file</li>
 *   <li>{@code unpack} - Unpack a container into a directory or another container</li>
 *   <li>{@code validate} - Decode a document and verify every digest</li>
 *   <li>{@code info} - Show manifest, attachments and database version</li>
 *   <li>{@code attach} - Add, remove or rename attachments</li>
 *   <li>{@code query} - Run SQL against the embedded database</li>
 *   <li>{@code export-html} - Render the document as HTML</li>
 *   <li>{@code db} - Export, import, reset or migrate the embedded database</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * tmd new trip
 * cp photo.png trip/images/
 * tmd pack trip trip.tmd
 * tmd query trip.tmd --sql "SELECT name FROM sqlite_master"
 * }</pre>
 */
@Command(
    name = "tmd",
    mixinStandardHelpOptions = true,
    version = "Tanu Markdown 1.0.0-SNAPSHOT",
    description = "Create, inspect and convert Tanu Markdown documents",
    subcommands = {
        NewCommand.class,
        PackCommand.class,
        UnpackCommand.class,
        ValidateCommand.class,
        InfoCommand.class,
        AttachCommand.class,
        QueryCommand.class,
        ExportHtmlCommand.class,
        DbCommand.class
    }
)
public class TanuMarkdownCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TanuMarkdownCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("Tanu Markdown - self-contained Markdown documents");
        System.out.println();
        System.out.println("Use 'tmd --help' to see available commands");
        System.out.println("Use 'tmd <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Root log level set to {}", root.getLevel());
    }

    /**
     * Builds the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        TanuMarkdownCLI cli = new TanuMarkdownCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
