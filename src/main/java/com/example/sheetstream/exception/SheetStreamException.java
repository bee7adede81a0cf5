package com.example.sheetstream.exception;

/**
 * Base class for all errors raised while streaming or assembling a worksheet.
 */
public class SheetStreamException extends RuntimeException {

    public SheetStreamException(String message) {
        super(message);
    }

    public SheetStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
