package org.dxworks.trustforge.markdown.block;

import java.util.List;

/**
 * A pipe table with every row already padded or truncated to {@link #columnCount()} cells.
 *
 * @param header header cells, null when the source had no alignment row
 */
public record PipeTable(List<String> header, List<ColumnAlignment> alignments, List<List<String>> rows) {

    public PipeTable {
        header = header == null ? null : List.copyOf(header);
        alignments = List.copyOf(alignments);
        rows = rows.stream().map(List::copyOf).toList();
    }

    public int columnCount() {
        return alignments.size();
    }

    public boolean hasHeader() {
        return header != null;
    }
}
