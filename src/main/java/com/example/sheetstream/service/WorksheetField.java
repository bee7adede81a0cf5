package com.example.sheetstream.service;

import com.example.sheetstream.model.WorksheetModel;
import lombok.Getter;

import java.util.function.Function;

/**
 * One top-level element of a worksheet part: its element name, how to read
 * it from the model, and whether its markup may be supplied from outside
 * the model (as streamed row data is).
 */
@Getter
public final class WorksheetField {

    private final String name;
    private final Function<WorksheetModel, ?> accessor;
    private final boolean replaceable;

    private WorksheetField(String name, Function<WorksheetModel, ?> accessor, boolean replaceable) {
        this.name = name;
        this.accessor = accessor;
        this.replaceable = replaceable;
    }

    static WorksheetField of(String name, Function<WorksheetModel, ?> accessor) {
        return new WorksheetField(name, accessor, false);
    }

    static WorksheetField replaceable(String name, Function<WorksheetModel, ?> accessor) {
        return new WorksheetField(name, accessor, true);
    }

    Object valueOf(WorksheetModel model) {
        return accessor.apply(model);
    }
}
