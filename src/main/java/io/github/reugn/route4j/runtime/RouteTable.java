package io.github.reugn.route4j.runtime;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Plain-text table used by generated route listings.
 *
 * <p>Renders a bordered table with left-aligned cells:
 * <pre>
 * +---------+---------+--------------+------+
 * | Scope   | Path    | Handler      | Verb |
 * +---------+---------+--------------+------+
 * | /events | /search | searchEvents | GET  |
 * +---------+---------+--------------+------+
 * </pre>
 */
public final class RouteTable {

    private final List<String> header;
    private final List<List<String>> rows = new ArrayList<>();

    private RouteTable(List<String> header) {
        this.header = header;
    }

    /**
     * Creates an empty table with the given column names.
     *
     * @param columns the column names
     * @return a new table
     * @throws IllegalArgumentException if no columns are given
     */
    public static RouteTable withHeader(String... columns) {
        if (columns.length == 0) {
            throw new IllegalArgumentException("A table requires at least one column");
        }
        return new RouteTable(List.of(columns));
    }

    /**
     * Appends a row.
     *
     * @param cells the cell values, one per column; {@code null} renders as empty
     * @return this table
     * @throws IllegalArgumentException if the cell count does not match the column count
     */
    public RouteTable addRow(String... cells) {
        if (cells.length != header.size()) {
            throw new IllegalArgumentException("Expected " + header.size() + " cells but got " + cells.length);
        }
        List<String> row = new ArrayList<>(cells.length);
        for (String cell : cells) {
            row.add(Objects.toString(cell, ""));
        }
        rows.add(row);
        return this;
    }

    public List<String> header() {
        return header;
    }

    public List<List<String>> rows() {
        return Collections.unmodifiableList(rows);
    }

    /**
     * Renders the table as text, lines separated by {@code '\n'}.
     *
     * @return the rendered table
     */
    public String render() {
        int[] widths = new int[header.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = header.get(i).length();
        }
        for (List<String> row : rows) {
            for (int i = 0; i < widths.length; i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }

        String border = border(widths);
        StringBuilder sb = new StringBuilder();
        sb.append(border).append('\n');
        appendLine(sb, header, widths);
        sb.append(border).append('\n');
        for (List<String> row : rows) {
            appendLine(sb, row, widths);
        }
        if (!rows.isEmpty()) {
            sb.append(border).append('\n');
        }
        return sb.toString();
    }

    /**
     * Writes the rendered table to the given stream.
     *
     * @param out the target stream
     */
    public void print(PrintStream out) {
        out.print(render());
        out.flush();
    }

    private static String border(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            char[] dashes = new char[width + 2];
            Arrays.fill(dashes, '-');
            sb.append(dashes).append('+');
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, List<String> cells, int[] widths) {
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            String cell = cells.get(i);
            sb.append(' ').append(cell);
            sb.append(" ".repeat(widths[i] - cell.length()));
            sb.append(" |");
        }
        sb.append('\n');
    }
}
