package com.example.sheetstream.stream;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Cell types written by the stream writer, with the value of their
 * {@code t} attribute. Numbers are the default and carry no attribute.
 */
@Getter
@RequiredArgsConstructor
public enum CellType {
    NUMBER(null),
    STRING("str"),
    BOOLEAN("b");

    private final String code;
}
