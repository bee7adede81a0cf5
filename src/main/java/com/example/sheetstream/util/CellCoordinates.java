package com.example.sheetstream.util;

import lombok.Value;

/**
 * A cell position with 1-based column and row numbers ("B3" is column 2, row 3).
 */
@Value
public class CellCoordinates {
    int column;
    int row;

    public String toCellName() {
        return CellReferences.toCellName(column, row);
    }
}
