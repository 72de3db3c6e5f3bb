package com.Excel.Book.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Workbook properties. A null field means "not set": it is left untouched when
 * setting and reported as null only when the workbook has no properties at all.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkbookPropsOptions {

    @JsonProperty("date1904")
    private Boolean date1904;

    @JsonProperty("filterPrivacy")
    private Boolean filterPrivacy;

    @JsonProperty("codeName")
    private String codeName;
}
