package com.example.inventory.service.table;

import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TableWriterTest {

    private final TableWriter writer = new TableWriter();

    private final TableView view = new TableView("latest_records",
            List.of("Workstation Name", "Subnet"),
            List.of(List.of("PC1", "10.0.0.0"), List.of("PC \"2\"", "10.0.1.0, 10.0.2.0")));

    @Test
    void writesCsvWithHeaderAndQuoting() {
        String csv = new String(writer.toBytes(view, OutputFormat.CSV), StandardCharsets.UTF_8);

        assertThat(csv).isEqualTo("Workstation Name,Subnet\r\n"
                + "PC1,10.0.0.0\r\n"
                + "\"PC \"\"2\"\"\",\"10.0.1.0, 10.0.2.0\"\r\n");
    }

    @Test
    void writesHeaderOnlyForEmptyView() {
        TableView empty = new TableView("unmatched_names", List.of("PC Name"), List.of());

        String csv = new String(writer.toBytes(empty, OutputFormat.CSV), StandardCharsets.UTF_8);

        assertThat(csv).isEqualTo("PC Name\r\n");
    }

    @Test
    void writesXlsxSheetNamedAfterView() throws Exception {
        byte[] bytes = writer.toBytes(view, OutputFormat.XLSX);

        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            Sheet sheet = workbook.getSheet("latest_records");
            assertThat(sheet).isNotNull();
            assertThat(sheet.getRow(0).getCell(0).getStringCellValue()).isEqualTo("Workstation Name");
            assertThat(sheet.getRow(2).getCell(0).getStringCellValue()).isEqualTo("PC \"2\"");
            assertThat(sheet.getRow(2).getCell(1).getStringCellValue()).isEqualTo("10.0.1.0, 10.0.2.0");
            assertThat(sheet.getLastRowNum()).isEqualTo(2);
        }
    }
}
