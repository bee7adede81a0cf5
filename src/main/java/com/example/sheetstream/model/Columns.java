package com.example.sheetstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Column widths and formatting, one entry per range of 1-based column numbers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JacksonXmlRootElement(localName = "cols")
public class Columns {

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "col")
    private List<Column> columns = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Column {

        @JacksonXmlProperty(isAttribute = true)
        private int min;

        @JacksonXmlProperty(isAttribute = true)
        private int max;

        @JacksonXmlProperty(isAttribute = true)
        private Double width;

        @JacksonXmlProperty(isAttribute = true)
        private Integer style;

        @JacksonXmlProperty(isAttribute = true)
        private Boolean customWidth;

        @JacksonXmlProperty(isAttribute = true)
        private Boolean hidden;
    }
}
