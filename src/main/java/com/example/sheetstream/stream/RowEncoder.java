package com.example.sheetstream.stream;

import com.example.sheetstream.util.CellCoordinates;
import com.example.sheetstream.util.CellReferences;

import java.util.List;

/**
 * Assembles the {@code <row>} element for one call of
 * {@link StreamWriter#setRow(String, List, List)}.
 *
 * The row is built off-buffer and only returned once every cell has been
 * encoded, so a failing cell never leaves half a row behind.
 */
public class RowEncoder {

    private final CellValueEncoder cellEncoder;

    public RowEncoder(CellValueEncoder cellEncoder) {
        this.cellEncoder = cellEncoder;
    }

    /**
     * @param start  coordinates of the first cell
     * @param values cell values in column order
     * @param styles style indices parallel to {@code values}, or {@code null}/empty for style 0
     * @return the {@code <row>} markup
     * @throws IllegalArgumentException if {@code styles} is non-empty and its size differs from {@code values},
     *                                  or if a style index is negative
     */
    public String encodeRow(CellCoordinates start, List<?> values, List<Integer> styles) {
        boolean styled = styles != null && !styles.isEmpty();
        if (styled && styles.size() != values.size()) {
            throw new IllegalArgumentException("incorrect number of styles for this row: expected "
                    + values.size() + " but got " + styles.size());
        }

        StringBuilder row = new StringBuilder(32 + values.size() * 32);
        row.append("<row r=\"").append(start.getRow()).append("\">");
        for (int i = 0; i < values.size(); i++) {
            int style = styled ? styleAt(styles, i) : 0;
            String cellName = CellReferences.toCellName(start.getColumn() + i, start.getRow());
            cellEncoder.encode(cellName, style, values.get(i)).appendTo(row);
        }
        row.append("</row>");
        return row.toString();
    }

    private static int styleAt(List<Integer> styles, int index) {
        Integer style = styles.get(index);
        if (style == null) {
            return 0;
        }
        if (style < 0) {
            throw new IllegalArgumentException("style index must not be negative: " + style);
        }
        return style;
    }
}
