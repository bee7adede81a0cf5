package com.example.sheetstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Row data of a sheet that is not streamed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JacksonXmlRootElement(localName = "sheetData")
public class SheetData {

    static final String XML_NAMESPACE = "http://www.w3.org/XML/1998/namespace";

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "row")
    private List<Row> rows = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class Row {

        /**
         * 1-based row number
         */
        @JacksonXmlProperty(isAttribute = true)
        private int r;

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "c")
        private List<Cell> cells = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"r", "s", "t", "cm", "vm", "ph", "space", "f", "v", "is"})
    public static class Cell {

        @JacksonXmlProperty(isAttribute = true)
        private String r;

        @JacksonXmlProperty(isAttribute = true)
        private Integer s;

        @JacksonXmlProperty(isAttribute = true)
        private String t;

        /**
         * Cell metadata index
         */
        @JacksonXmlProperty(isAttribute = true)
        private Integer cm;

        /**
         * Value metadata index
         */
        @JacksonXmlProperty(isAttribute = true)
        private Integer vm;

        /**
         * "1" when phonetic text is shown
         */
        @JacksonXmlProperty(isAttribute = true)
        private String ph;

        /**
         * "preserve" when leading or trailing spaces of the value are significant
         */
        @JacksonXmlProperty(isAttribute = true, localName = "space", namespace = XML_NAMESPACE)
        private String space;

        @JacksonXmlProperty(localName = "f")
        private String f;

        @JacksonXmlProperty(localName = "v")
        private String v;

        /**
         * Inline string of a cell with {@code t="inlineStr"}
         */
        @JacksonXmlProperty(localName = "is")
        private InlineString is;
    }

    /**
     * Plain inline string. Rich text runs ({@code <r>}) are not modelled.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class InlineString {

        @JacksonXmlProperty(localName = "t")
        private Text t;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Text {

        @JacksonXmlProperty(isAttribute = true, localName = "space", namespace = XML_NAMESPACE)
        private String space;

        @JacksonXmlText
        private String value;
    }
}
