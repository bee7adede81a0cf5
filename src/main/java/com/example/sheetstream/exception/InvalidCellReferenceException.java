package com.example.sheetstream.exception;

/**
 * Thrown for malformed cell names ("A0", "1A", "Sheet1!B2") and for
 * coordinates outside the worksheet grid.
 */
public class InvalidCellReferenceException extends SheetStreamException {

    public InvalidCellReferenceException(String message) {
        super(message);
    }

    public InvalidCellReferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
