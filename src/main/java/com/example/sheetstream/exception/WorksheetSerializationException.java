package com.example.sheetstream.exception;

import lombok.Getter;

@Getter
public class WorksheetSerializationException extends SheetStreamException {

    private final String fieldName;

    public WorksheetSerializationException(String fieldName, String message, Throwable cause) {
        super(message, cause);
        this.fieldName = fieldName;
    }
}
