package org.dxworks.trustforge.markdown.block;

public enum ColumnAlignment {
    LEFT,
    CENTER,
    RIGHT;

    /**
     * {@code :---} left, {@code :---:} center, {@code ---:} right, {@code ---} left.
     */
    public static ColumnAlignment fromSeparatorCell(String cell) {
        boolean left = cell.startsWith(":");
        boolean right = cell.endsWith(":");
        if (left && right) {
            return CENTER;
        }
        return right ? RIGHT : LEFT;
    }
}
