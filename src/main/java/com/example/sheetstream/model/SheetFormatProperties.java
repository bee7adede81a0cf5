package com.example.sheetstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JacksonXmlRootElement(localName = "sheetFormatPr")
public class SheetFormatProperties {

    @JacksonXmlProperty(isAttribute = true)
    private Integer baseColWidth;

    @JacksonXmlProperty(isAttribute = true)
    private Double defaultColWidth;

    @Builder.Default
    @JacksonXmlProperty(isAttribute = true)
    private double defaultRowHeight = 15;
}
