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
@JacksonXmlRootElement(localName = "sheetPr")
public class SheetProperties {

    @JacksonXmlProperty(isAttribute = true)
    private String codeName;

    @JacksonXmlProperty(isAttribute = true)
    private Boolean filterMode;

    @JacksonXmlProperty(localName = "tabColor")
    private TabColor tabColor;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TabColor {
        /**
         * ARGB hex value, e.g. "FFFF0000"
         */
        @JacksonXmlProperty(isAttribute = true)
        private String rgb;
    }
}
