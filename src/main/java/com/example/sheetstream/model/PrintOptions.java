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
@JacksonXmlRootElement(localName = "printOptions")
public class PrintOptions {

    @JacksonXmlProperty(isAttribute = true)
    private Boolean horizontalCentered;

    @JacksonXmlProperty(isAttribute = true)
    private Boolean verticalCentered;

    @JacksonXmlProperty(isAttribute = true)
    private Boolean headings;

    @JacksonXmlProperty(isAttribute = true)
    private Boolean gridLines;
}
