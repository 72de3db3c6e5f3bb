package com.Excel.Book.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "workbook.storage")
public class WorkbookStorageProperties {

    /**
     * Directory holding the workbook packages, one {@code <name>.xlsx} each.
     */
    private String dir = "./workbooks";
}
