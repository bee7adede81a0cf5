package com.example.sheetstream.exception;

/**
 * Thrown when spilled row data cannot be recovered from its temporary file.
 */
public class SpillFileException extends SheetStreamException {

    public SpillFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
