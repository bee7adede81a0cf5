package com.example.sheetstream.service;

import com.example.sheetstream.exception.WorksheetSerializationException;
import com.example.sheetstream.model.SheetData;
import com.example.sheetstream.model.WorksheetModel;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes worksheet parts field by field.
 *
 * The fields are listed explicitly in schema order. Each one is written with
 * Jackson XML unless the caller supplies ready-made markup for it, which is
 * only allowed for fields declared replaceable ({@code sheetData}). The root
 * element and its namespace declarations are fixed and never come from the
 * model.
 */
@Component
public class WorksheetSerializer {

    public static final String SHEET_DATA = "sheetData";

    public static final String XML_HEADER = "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\n";

    public static final String WORKSHEET_START = "<worksheet"
            + " xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\""
            + " xmlns:r=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships\""
            + " xmlns:mc=\"http://schemas.openxmlformats.org/markup-compatibility/2006\""
            + " xmlns:x14ac=\"http://schemas.microsoft.com/office/spreadsheetml/2009/9/ac\""
            + " mc:Ignorable=\"x14ac\">";

    public static final String WORKSHEET_END = "</worksheet>";

    static final List<WorksheetField> FIELDS = List.of(
            WorksheetField.of("sheetPr", WorksheetModel::getSheetPr),
            WorksheetField.of("dimension", WorksheetModel::getDimension),
            WorksheetField.of("sheetViews", WorksheetModel::getSheetViews),
            WorksheetField.of("sheetFormatPr", WorksheetModel::getSheetFormatPr),
            WorksheetField.of("cols", WorksheetModel::getCols),
            WorksheetField.replaceable(SHEET_DATA, WorksheetModel::getSheetData),
            WorksheetField.of("autoFilter", WorksheetModel::getAutoFilter),
            WorksheetField.of("mergeCells", WorksheetModel::getMergeCells),
            WorksheetField.of("printOptions", WorksheetModel::getPrintOptions),
            WorksheetField.of("pageMargins", WorksheetModel::getPageMargins),
            WorksheetField.of("pageSetup", WorksheetModel::getPageSetup),
            WorksheetField.of("headerFooter", WorksheetModel::getHeaderFooter)
    );

    private static final byte[] EMPTY_SHEET_DATA = "<sheetData/>".getBytes(StandardCharsets.UTF_8);

    private final XmlMapper xmlMapper = XmlMapper.builder()
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    public List<String> getFieldNames() {
        return FIELDS.stream().map(WorksheetField::getName).collect(Collectors.toList());
    }

    /**
     * Serialize the complete model.
     */
    public byte[] serialize(WorksheetModel model) {
        return serialize(model, Collections.emptyMap());
    }

    /**
     * Serialize the model, writing the given markup verbatim in place of the
     * named fields.
     *
     * @param replacements markup keyed by field name; only replaceable fields may be named
     * @throws IllegalArgumentException         if a replacement names an unknown or non-replaceable field
     * @throws WorksheetSerializationException if a field cannot be serialized
     */
    public byte[] serialize(WorksheetModel model, Map<String, byte[]> replacements) {
        int replacementSize = replacements.values().stream().mapToInt(b -> b.length).sum();
        ByteArrayOutputStream out = new ByteArrayOutputStream(replacementSize + 1024);
        try {
            writeTo(model, replacements, out);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    public void writeTo(WorksheetModel model, Map<String, byte[]> replacements, OutputStream out) throws IOException {
        checkReplacements(replacements);
        out.write(XML_HEADER.getBytes(StandardCharsets.UTF_8));
        out.write(WORKSHEET_START.getBytes(StandardCharsets.UTF_8));
        for (WorksheetField field : FIELDS) {
            byte[] replacement = replacements.get(field.getName());
            if (replacement != null) {
                out.write(replacement);
            } else {
                out.write(serializeField(field, model));
            }
        }
        out.write(WORKSHEET_END.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Parse a worksheet part back into a model. Elements that the model does
     * not cover are dropped, among them rich text runs of inline strings
     * and extension lists ({@code extLst}).
     */
    public WorksheetModel deserialize(byte[] part) {
        try {
            WorksheetModel model = xmlMapper.readValue(part, WorksheetModel.class);
            if (model.getSheetData() == null) {
                model.setSheetData(new SheetData());
            }
            return model;
        } catch (IOException e) {
            throw new WorksheetSerializationException("worksheet", "Failed to parse worksheet part", e);
        }
    }

    private byte[] serializeField(WorksheetField field, WorksheetModel model) {
        Object value = field.valueOf(model);
        if (value == null) {
            return SHEET_DATA.equals(field.getName()) ? EMPTY_SHEET_DATA : new byte[0];
        }
        try {
            return xmlMapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new WorksheetSerializationException(field.getName(),
                    "Failed to serialize worksheet field " + field.getName(), e);
        }
    }

    private static void checkReplacements(Map<String, byte[]> replacements) {
        for (String name : replacements.keySet()) {
            boolean allowed = FIELDS.stream()
                    .anyMatch(field -> field.getName().equals(name) && field.isReplaceable());
            if (!allowed) {
                throw new IllegalArgumentException("worksheet field " + name + " cannot be replaced");
            }
        }
    }
}
