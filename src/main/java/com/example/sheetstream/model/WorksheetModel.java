package com.example.sheetstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * In-memory model of one worksheet part.
 *
 * Properties are declared in the element order of the worksheet schema;
 * {@link com.example.sheetstream.service.WorksheetSerializer} writes them
 * in that order. Absent (null) elements are not written.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"sheetPr", "dimension", "sheetViews", "sheetFormatPr", "cols", "sheetData",
        "autoFilter", "mergeCells", "printOptions", "pageMargins", "pageSetup", "headerFooter"})
@JacksonXmlRootElement(localName = "worksheet")
public class WorksheetModel {

    @JacksonXmlProperty(localName = "sheetPr")
    private SheetProperties sheetPr;

    @JacksonXmlProperty(localName = "dimension")
    private SheetDimension dimension;

    @JacksonXmlProperty(localName = "sheetViews")
    private SheetViews sheetViews;

    @JacksonXmlProperty(localName = "sheetFormatPr")
    private SheetFormatProperties sheetFormatPr;

    @JacksonXmlProperty(localName = "cols")
    private Columns cols;

    /**
     * Row data; always present, replaced wholesale when the sheet is streamed
     */
    @Builder.Default
    @JacksonXmlProperty(localName = "sheetData")
    private SheetData sheetData = new SheetData();

    @JacksonXmlProperty(localName = "autoFilter")
    private AutoFilter autoFilter;

    @JacksonXmlProperty(localName = "mergeCells")
    private MergeCells mergeCells;

    @JacksonXmlProperty(localName = "printOptions")
    private PrintOptions printOptions;

    @JacksonXmlProperty(localName = "pageMargins")
    private PageMargins pageMargins;

    @JacksonXmlProperty(localName = "pageSetup")
    private PageSetup pageSetup;

    @JacksonXmlProperty(localName = "headerFooter")
    private HeaderFooter headerFooter;
}
