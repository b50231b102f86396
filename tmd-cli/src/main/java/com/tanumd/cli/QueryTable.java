package com.tanumd.cli;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Query result rendered as a Markdown table.
 *
 * @param columns column labels
 * @param rows cell text, row by row
 */
public record QueryTable(List<String> columns, List<List<String>> rows) {

    public QueryTable {
        columns = List.copyOf(columns);
        rows = rows.stream().map(List::copyOf).toList();
    }

    /**
     * Reads every row of a result set.
     *
     * <p>SQL NULL becomes {@code NULL} and blobs become {@code <blob>}.
     *
     * @param rs open result set
     * @return table
     * @throws SQLException if reading fails
     */
    public static QueryTable from(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int count = meta.getColumnCount();
        List<String> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            columns.add(meta.getColumnLabel(i));
        }
        List<List<String>> rows = new ArrayList<>();
        while (rs.next()) {
            List<String> row = new ArrayList<>(count);
            for (int i = 1; i <= count; i++) {
                row.add(display(rs.getObject(i)));
            }
            rows.add(row);
        }
        return new QueryTable(columns, rows);
    }

    /**
     * Renders the table as Markdown, one line per row.
     *
     * @return Markdown text ending with a newline
     */
    public String toMarkdown() {
        StringBuilder sb = new StringBuilder();
        appendRow(sb, columns);
        appendRow(sb, Collections.nCopies(columns.size(), "---"));
        for (List<String> row : rows) {
            appendRow(sb, row);
        }
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, List<String> cells) {
        sb.append("| ");
        sb.append(String.join(" | ", cells.stream().map(QueryTable::escape).toList()));
        sb.append(" |\n");
    }

    private static String display(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof byte[]) {
            return "<blob>";
        }
        return value.toString();
    }

    private static String escape(String cell) {
        return cell.replace("|", "\\|").replace("\n", " ");
    }
}
