package com.example.inventory.service.table;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

@Component
public class TableWriter {
    private static final int MAX_COLUMN_CHARS = 60;

    public byte[] toBytes(TableView view, OutputFormat format) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(view, format, out);
        } catch (IOException e) {
            throw new IllegalStateException("Export of " + view.name() + " failed: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    /**
     * Writes the view to {@code out}. The stream is flushed but left open.
     */
    public void write(TableView view, OutputFormat format, OutputStream out) throws IOException {
        switch (format) {
            case CSV -> writeCsv(view, out);
            case XLSX -> writeXlsx(view, out);
        }
        out.flush();
    }

    private void writeCsv(TableView view, OutputStream out) throws IOException {
        CSVFormat csv = CSVFormat.DEFAULT.builder()
                .setHeader(view.headers().toArray(String[]::new))
                .build();
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        CSVPrinter printer = new CSVPrinter(writer, csv);
        for (List<String> row : view.rows()) {
            printer.printRecord(row);
        }
        printer.flush();
    }

    private void writeXlsx(TableView view, OutputStream out) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(WorkbookUtil.createSafeSheetName(view.name()));

            CellStyle headerStyle = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            headerStyle.setFont(bold);

            int[] widths = new int[view.headers().size()];
            Row header = sheet.createRow(0);
            for (int i = 0; i < view.headers().size(); i++) {
                String name = view.headers().get(i);
                header.createCell(i).setCellValue(name);
                header.getCell(i).setCellStyle(headerStyle);
                widths[i] = name.length();
            }

            for (int r = 0; r < view.rows().size(); r++) {
                Row row = sheet.createRow(r + 1);
                List<String> values = view.rows().get(r);
                for (int c = 0; c < values.size(); c++) {
                    String value = values.get(c) == null ? "" : values.get(c);
                    row.createCell(c).setCellValue(value);
                    if (c < widths.length) {
                        widths[c] = Math.max(widths[c], value.length());
                    }
                }
            }

            // character-count widths; autoSizeColumn needs AWT fonts on the host
            for (int c = 0; c < widths.length; c++) {
                sheet.setColumnWidth(c, (Math.min(widths[c], MAX_COLUMN_CHARS) + 2) * 256);
            }
            sheet.createFreezePane(0, 1);
            workbook.write(out);
        }
    }
}
