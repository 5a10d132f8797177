package org.dxworks.trustforge.markdown.block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns captured GitHub-style pipe rows into a {@link PipeTable}. Ragged rows are normalized,
 * never rejected.
 */
public final class TableAssembler {

    private static final Pattern PIPE_ROW = Pattern.compile("^\\s*\\|.*\\|\\s*$");
    private static final Pattern SEPARATOR_CELL = Pattern.compile("^\\s*:?-+:?\\s*$");

    private TableAssembler() {}

    public static boolean isPipeRow(String line) {
        return PIPE_ROW.matcher(line).matches();
    }

    /**
     * Splits {@code | a | b |} into {@code [a, b]}. Leading and trailing pipes are optional.
     */
    public static List<String> splitRow(String row) {
        String stripped = row.strip();
        if (stripped.startsWith("|")) {
            stripped = stripped.substring(1);
        }
        if (stripped.endsWith("|")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        List<String> cells = new ArrayList<>();
        for (String cell : stripped.split("\\|", -1)) {
            cells.add(cell.strip());
        }
        return cells;
    }

    public static boolean isSeparatorRow(List<String> cells) {
        if (cells.isEmpty()) {
            return false;
        }
        return cells.stream().allMatch(cell -> SEPARATOR_CELL.matcher(cell).matches());
    }

    public static PipeTable assemble(List<String> rawRows) {
        List<List<String>> rows = new ArrayList<>();
        for (String raw : rawRows) {
            rows.add(splitRow(raw));
        }
        if (rows.isEmpty()) {
            return new PipeTable(null, List.of(), List.of());
        }

        if (rows.size() >= 2 && isSeparatorRow(rows.get(1))) {
            List<ColumnAlignment> alignments = new ArrayList<>();
            for (String cell : rows.get(1)) {
                alignments.add(ColumnAlignment.fromSeparatorCell(cell.strip()));
            }
            int columns = alignments.size();
            List<List<String>> body = new ArrayList<>();
            for (List<String> row : rows.subList(2, rows.size())) {
                body.add(fit(row, columns));
            }
            return new PipeTable(fit(rows.get(0), columns), alignments, body);
        }

        int columns = rows.get(0).size();
        List<List<String>> body = new ArrayList<>();
        for (List<String> row : rows) {
            body.add(fit(row, columns));
        }
        return new PipeTable(null, Collections.nCopies(columns, ColumnAlignment.LEFT), body);
    }

    private static List<String> fit(List<String> cells, int columns) {
        if (cells.size() == columns) {
            return cells;
        }
        if (cells.size() > columns) {
            return new ArrayList<>(cells.subList(0, columns));
        }
        List<String> padded = new ArrayList<>(cells);
        while (padded.size() < columns) {
            padded.add("");
        }
        return padded;
    }
}
