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

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JacksonXmlRootElement(localName = "sheetViews")
public class SheetViews {

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "sheetView")
    private List<SheetView> views = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SheetView {

        @JacksonXmlProperty(isAttribute = true)
        private Boolean tabSelected;

        @JacksonXmlProperty(isAttribute = true)
        private Boolean showGridLines;

        @JacksonXmlProperty(isAttribute = true)
        private Integer zoomScale;

        @Builder.Default
        @JacksonXmlProperty(isAttribute = true)
        private int workbookViewId = 0;
    }
}
