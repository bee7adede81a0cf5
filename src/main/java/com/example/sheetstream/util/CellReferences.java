package com.example.sheetstream.util;

import com.example.sheetstream.exception.InvalidCellReferenceException;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.util.CellReference;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversion between cell names ("AB12") and 1-based column/row numbers,
 * bounded by the limits of the Office Open XML grid (XFD1048576).
 */
public final class CellReferences {

    public static final int MAX_COLUMNS = SpreadsheetVersion.EXCEL2007.getMaxColumns();
    public static final int MAX_ROWS = SpreadsheetVersion.EXCEL2007.getMaxRows();

    private static final Pattern CELL_NAME = Pattern.compile("^\\$?([A-Za-z]{1,3})\\$?([0-9]{1,7})$");

    private CellReferences() {
    }

    /**
     * Parse a cell name, with optional "$" absolute markers, into coordinates.
     *
     * @throws InvalidCellReferenceException if the name is malformed or outside the grid
     */
    public static CellCoordinates parse(String cellName) {
        if (cellName == null) {
            throw new InvalidCellReferenceException("cell name must not be null");
        }
        Matcher matcher = CELL_NAME.matcher(cellName.trim());
        if (!matcher.matches()) {
            throw new InvalidCellReferenceException("invalid cell name \"" + cellName + "\"");
        }
        int column = CellReference.convertColStringToIndex(matcher.group(1).toUpperCase()) + 1;
        int row = Integer.parseInt(matcher.group(2));
        checkBounds(column, row);
        return new CellCoordinates(column, row);
    }

    /**
     * Format 1-based coordinates as a cell name, e.g. (28, 3) to "AB3".
     *
     * @throws InvalidCellReferenceException if the coordinates are outside the grid
     */
    public static String toCellName(int column, int row) {
        checkBounds(column, row);
        return CellReference.convertNumToColString(column - 1) + row;
    }

    private static void checkBounds(int column, int row) {
        if (column < 1 || column > MAX_COLUMNS) {
            throw new InvalidCellReferenceException(
                    "column number " + column + " is out of range 1.." + MAX_COLUMNS);
        }
        if (row < 1 || row > MAX_ROWS) {
            throw new InvalidCellReferenceException(
                    "row number " + row + " is out of range 1.." + MAX_ROWS);
        }
    }
}
