package com.example.sheetstream.exception;

import lombok.Getter;

/**
 * Thrown when a sheet name does not resolve to a sheet of the document,
 * either because it never existed or because it was deleted meanwhile.
 */
@Getter
public class SheetNotFoundException extends SheetStreamException {

    private final String sheetName;

    public SheetNotFoundException(String sheetName) {
        super("sheet " + sheetName + " does not exist");
        this.sheetName = sheetName;
    }
}
