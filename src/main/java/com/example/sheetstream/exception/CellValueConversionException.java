package com.example.sheetstream.exception;

import lombok.Getter;

/**
 * Thrown when a cell value cannot be represented in the worksheet,
 * e.g. a timestamp outside the range of serial date numbers.
 */
@Getter
public class CellValueConversionException extends SheetStreamException {

    private final String cellName;

    public CellValueConversionException(String cellName, String message) {
        super("cannot convert value of cell " + cellName + ": " + message);
        this.cellName = cellName;
    }
}
