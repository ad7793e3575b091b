package com.example.inventory.service.table;

import com.example.inventory.config.InventoryProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the first usable table out of a workbook ({@code .xlsx}/{@code .xls}) or a {@code .csv} file.
 * <p>
 * In workbooks the header row is the first row, within {@value #HEADER_SCAN_LIMIT} rows of the top,
 * that contains one of the anchor headers; title and instruction rows above it are ignored.
 * Hidden rows are skipped and reading stops after {@value #EMPTY_ROW_LIMIT} consecutive empty rows.
 */
@Slf4j
@Component
public class TableReader {
    static final int HEADER_SCAN_LIMIT = 30;
    static final int EMPTY_ROW_LIMIT = 30;
    private static final int DENSITY_ROW_LIMIT = 80;
    private static final int DENSITY_COLUMN_LIMIT = 50;

    private final DateTimeFormatter timestampFormat;

    public TableReader(InventoryProperties properties) {
        this.timestampFormat = properties.timestampFormatter();
    }

    public Table read(InputStream input, String fileName, Collection<String> anchorHeaders) {
        Set<String> anchors = new HashSet<>(HeaderNames.normalizeAll(anchorHeaders));
        if (anchors.isEmpty()) {
            throw new IllegalArgumentException("At least one anchor header is required");
        }
        if (isDelimited(fileName)) {
            return readCsv(input, fileName, anchors);
        }
        return readWorkbook(input, fileName, anchors);
    }

    static boolean isDelimited(String fileName) {
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".csv");
    }

    private Table readCsv(InputStream input, String fileName, Set<String> anchors) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setAllowMissingColumnNames(true)
                .setIgnoreEmptyLines(true)
                .setTrim(true)
                .build();
        try {
            String text = new String(input.readAllBytes(), StandardCharsets.UTF_8);
            return readCsv(text, fileName, anchors, format);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + fileName + ": " + e.getMessage(), e);
        }
    }

    private Table readCsv(String text, String fileName, Set<String> anchors, CSVFormat format) throws IOException {
        try (CSVParser parser = format.parse(new StringReader(text))) {
            List<String> headers = new ArrayList<>();
            for (String header : parser.getHeaderNames()) {
                headers.add(header.replace("\uFEFF", "").trim());
            }
            if (!containsAnchor(headers, anchors)) {
                throw new TableFormatException("File " + fileName + " has no column named "
                        + String.join(" / ", anchors) + " in its first line");
            }
            List<TableRow> rows = new ArrayList<>();
            LineLocator lines = new LineLocator(text);
            for (CSVRecord record : parser) {
                List<String> values = new ArrayList<>(headers.size());
                for (int c = 0; c < headers.size(); c++) {
                    values.add(c < record.size() ? record.get(c) : "");
                }
                if (values.stream().allMatch(String::isBlank)) {
                    continue;
                }
                rows.add(new TableRow(lines.lineOf(record.getCharacterPosition()), values));
            }
            log.debug("Read {} rows from {}", rows.size(), fileName);
            return new Table(fileName, headers, rows, 0);
        }
    }

    private Table readWorkbook(InputStream input, String fileName, Set<String> anchors) {
        try (Workbook workbook = WorkbookFactory.create(input)) {
            DataFormatter fmt = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            for (Sheet sheet : rankSheetsByDensity(workbook, fmt)) {
                int headerRowIndex = findHeaderRowByAnchor(sheet, anchors, fmt);
                if (headerRowIndex < 0) {
                    continue;
                }
                return readSheet(sheet, headerRowIndex, fileName, fmt, evaluator);
            }
            throw new TableFormatException("No header row with " + String.join(" / ", anchors)
                    + " found in the first " + HEADER_SCAN_LIMIT + " rows of any sheet in " + fileName);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + fileName + ": " + e.getMessage(), e);
        }
    }

    private Table readSheet(Sheet sheet, int headerRowIndex, String fileName,
                            DataFormatter fmt, FormulaEvaluator evaluator) {
        Row headerRow = sheet.getRow(headerRowIndex);
        List<String> headers = new ArrayList<>();
        List<Integer> columnIndexes = new ArrayList<>();
        for (int c = headerRow.getFirstCellNum(); c < headerRow.getLastCellNum(); c++) {
            String name = cellText(headerRow.getCell(c), fmt, evaluator);
            if (name.isBlank()) {
                continue;
            }
            headers.add(name);
            columnIndexes.add(c);
        }

        List<TableRow> rows = new ArrayList<>();
        int hidden = 0;
        int emptyStreak = 0;
        for (int r = headerRowIndex + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                if (++emptyStreak >= EMPTY_ROW_LIMIT) {
                    break;
                }
                continue;
            }
            // filtered out or collapsed rows are not part of the report
            if (row.getZeroHeight()) {
                hidden++;
                continue;
            }
            List<String> values = new ArrayList<>(columnIndexes.size());
            boolean blank = true;
            for (Integer col : columnIndexes) {
                String value = cellText(row.getCell(col), fmt, evaluator);
                if (!value.isBlank()) {
                    blank = false;
                }
                values.add(value);
            }
            if (blank) {
                if (++emptyStreak >= EMPTY_ROW_LIMIT) {
                    break;
                }
                continue;
            }
            emptyStreak = 0;
            rows.add(new TableRow(r + 1, values));
        }

        if (hidden > 0) {
            log.warn("Skipped {} hidden rows in sheet '{}' of {}", hidden, sheet.getSheetName(), fileName);
        }
        log.debug("Read {} rows from sheet '{}' of {} (header on row {})",
                rows.size(), sheet.getSheetName(), fileName, headerRowIndex + 1);
        return new Table(fileName + "#" + sheet.getSheetName(), headers, rows, hidden);
    }

    private String cellText(Cell cell, DataFormatter fmt, FormulaEvaluator evaluator) {
        if (cell == null) {
            return "";
        }
        CellType cellType = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        if (cellType == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
            return cell.getLocalDateTimeCellValue().format(timestampFormat);
        }
        return fmt.formatCellValue(cell, evaluator).trim();
    }

    private int findHeaderRowByAnchor(Sheet sheet, Set<String> anchors, DataFormatter fmt) {
        int first = sheet.getFirstRowNum();
        int last = Math.min(sheet.getLastRowNum(), first + HEADER_SCAN_LIMIT);
        for (int r = first; r <= last; r++) {
            Row row = sheet.getRow(r);
            if (row == null || row.getFirstCellNum() < 0) {
                continue;
            }
            List<String> rowHeaders = new ArrayList<>();
            for (int c = row.getFirstCellNum(); c < row.getLastCellNum(); c++) {
                Cell cell = row.getCell(c);
                rowHeaders.add(cell == null ? "" : fmt.formatCellValue(cell));
            }
            if (containsAnchor(rowHeaders, anchors)) {
                return r;
            }
        }
        return -1;
    }

    private static boolean containsAnchor(List<String> headers, Set<String> anchors) {
        for (String header : headers) {
            if (anchors.contains(HeaderNames.normalize(header))) {
                return true;
            }
        }
        return false;
    }

    private List<Sheet> rankSheetsByDensity(Workbook workbook, DataFormatter fmt) {
        List<SheetScore> scored = new ArrayList<>();
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            Sheet sheet = workbook.getSheetAt(i);
            scored.add(new SheetScore(sheet, densityScore(sheet, fmt)));
        }
        // stable sort: equally dense sheets keep workbook order
        scored.sort(Comparator.comparingInt(SheetScore::score).reversed());
        return scored.stream().map(SheetScore::sheet).toList();
    }

    private int densityScore(Sheet sheet, DataFormatter fmt) {
        int score = 0;
        int maxRow = Math.min(sheet.getLastRowNum(), DENSITY_ROW_LIMIT);
        for (int r = sheet.getFirstRowNum(); r <= maxRow; r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            short firstCell = row.getFirstCellNum();
            short lastCell = row.getLastCellNum();
            if (firstCell < 0 || lastCell < 0) {
                continue;
            }
            int endCol = Math.min(lastCell, firstCell + DENSITY_COLUMN_LIMIT);
            for (int c = firstCell; c < endCol; c++) {
                Cell cell = row.getCell(c);
                String v = cell == null ? "" : fmt.formatCellValue(cell).trim();
                if (!v.isBlank()) {
                    score++;
                }
            }
        }
        return score;
    }

    private record SheetScore(Sheet sheet, int score) {
    }

    /**
     * Maps character offsets of CSV records to 1-based physical line numbers, so row numbers stay
     * right across skipped empty lines and quoted values that span lines. Offsets must not decrease.
     */
    private static final class LineLocator {
        private final String text;
        private int pos;
        private int line = 1;

        LineLocator(String text) {
            this.text = text;
        }

        int lineOf(long offset) {
            int target = (int) Math.min(offset, text.length());
            while (pos < target) {
                advance();
            }
            // a record offset may point at empty lines the parser skipped before it
            while (pos < text.length() && (text.charAt(pos) == '\r' || text.charAt(pos) == '\n')) {
                advance();
            }
            return line;
        }

        private void advance() {
            char c = text.charAt(pos++);
            if (c == '\n' || (c == '\r' && (pos >= text.length() || text.charAt(pos) != '\n'))) {
                line++;
            }
        }
    }
}
