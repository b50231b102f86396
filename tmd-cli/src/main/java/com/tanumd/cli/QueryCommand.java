package com.tanumd.cli;

import com.tanumd.core.document.TmdDocument;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Command to run a read-only SQL query against the embedded database and print the result
 * as a Markdown table.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * tmd query report.tmd --sql "SELECT name, qty FROM items ORDER BY name"
 * }</pre>
 */
@Command(
    name = "query",
    description = "Execute a read-only SQL query against the embedded SQLite database",
    mixinStandardHelpOptions = true
)
public class QueryCommand extends DocumentCommand {

    @Parameters(index = "0", description = "Document to query")
    private Path input;

    @Option(names = "--sql", required = true, description = "SQL query")
    private String sql;

    @Override
    protected void execute() throws Exception {
        try (TmdDocument doc = DocumentIO.load(input, config.load())) {
            QueryTable table = doc.withRead(connection -> {
                try (Statement statement = connection.createStatement();
                     ResultSet rs = statement.executeQuery(sql)) {
                    return QueryTable.from(rs);
                }
            });
            out().print(table.toMarkdown());
            out().flush();
        }
    }
}
