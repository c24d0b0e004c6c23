package org.dxworks.mddocx.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A table with plain-text cells. Inline formatting inside cells is not kept.
 * Rows are not padded to the header width; {@link #getColumnCount()} derives the width instead.
 */
public final class TableNode extends BlockNode {
    public final List<String> headers;
    public final List<List<String>> rows;
    public final List<ColumnAlignment> alignments; // per header column, null entries mean unspecified
    public final TableLayout layout;

    public TableNode(List<String> headers, List<List<String>> rows,
                     List<ColumnAlignment> alignments, TableLayout layout) {
        super(BlockType.TABLE);
        this.headers = List.copyOf(headers);
        List<List<String>> copiedRows = new ArrayList<>();
        for (List<String> row : rows) {
            copiedRows.add(List.copyOf(row));
        }
        this.rows = Collections.unmodifiableList(copiedRows);
        this.alignments = Collections.unmodifiableList(new ArrayList<>(alignments));
        this.layout = layout == null ? TableLayout.AUTOFIT : layout;
    }

    public int getColumnCount() {
        int max = headers.size();
        for (List<String> row : rows) {
            max = Math.max(max, row.size());
        }
        return Math.max(max, 1);
    }
}
