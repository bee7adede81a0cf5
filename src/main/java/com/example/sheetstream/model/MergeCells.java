package com.example.sheetstream.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JacksonXmlRootElement(localName = "mergeCells")
public class MergeCells {

    @JacksonXmlProperty(isAttribute = true)
    private Integer count;

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "mergeCell")
    private List<MergeCell> cells = new ArrayList<>();

    /**
     * Add a merged range such as "A1:B2" and keep {@code count} in step.
     */
    public MergeCells add(String ref) {
        cells.add(new MergeCell(ref));
        count = cells.size();
        return this;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MergeCell {

        @JacksonXmlProperty(isAttribute = true)
        private String ref;
    }
}
