package com.Excel.Book.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settings for protecting the workbook structure. Without a password only the
 * lock flags change.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkbookProtectionOptions {

    @JsonProperty("algorithmName")
    private String algorithmName;  // XOR, MD4, MD5, SHA-1, SHA-256, SHA-384 or SHA-512; SHA-512 when empty

    @JsonProperty(value = "password", access = JsonProperty.Access.WRITE_ONLY)
    private String password;

    @JsonProperty("lockStructure")
    private boolean lockStructure;

    @JsonProperty("lockWindows")
    private boolean lockWindows;
}
