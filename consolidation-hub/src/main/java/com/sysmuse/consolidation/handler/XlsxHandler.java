package com.sysmuse.consolidation.handler;

import com.sysmuse.consolidation.normalize.ColumnNormalizer;
import com.sysmuse.consolidation.table.DataBatch;
import com.sysmuse.consolidation.table.ValueParser;
import com.sysmuse.consolidation.util.LoggingUtil;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;

/**
 * XlsxHandler - Excel workbooks through Apache POI.
 * A workbook is read in one piece; several sheets are merged into one batch
 * with a sheet_name column recording where each row came from.
 */
public class XlsxHandler extends AbstractFileHandler {

    public static final String DEFAULT_SHEET_NAME = "Sheet1";

    private static final Set<String> READ_OPTIONS = new HashSet<>(Arrays.asList(
            "sheet_name", "sheet", "nrows", "skiprows", "na_values", "dtype"));
    private static final Set<String> WRITE_OPTIONS = new HashSet<>(Arrays.asList(
            "sheet_name", "index", "index_label", "header", "na_rep"));

    // Largest double that still holds every integer exactly
    private static final double MAX_EXACT_INTEGER = 9007199254740992d;

    public XlsxHandler() {
        super("xlsx", READ_OPTIONS, WRITE_OPTIONS);
    }

    @Override
    public Integer schemaSampleRows() {
        return 5;
    }

    @Override
    public BatchReader read(Path path, Map<String, ?> options, ColumnNormalizer normalizer) throws IOException {
        Map<String, Object> readOptions = filterOptions(options, Mode.READ);
        Object selector = readOptions.containsKey("sheet_name") ? readOptions.get("sheet_name") : readOptions.get("sheet");
        validateSelector(selector);

        Integer maxRows = intOption(readOptions, "nrows", null);
        int skipRows = intOption(readOptions, "skiprows", 0);
        ValueParser parser = parserFor(readOptions);

        LoggingUtil.debug("Reading Excel file: " + path + " (sheet selector: " + selector + ")");
        try (InputStream in = Files.newInputStream(path);
             Workbook workbook = new XSSFWorkbook(in)) {

            if (isAllSheets(selector) || selector instanceof List) {
                List<?> selectors = selector instanceof List ? (List<?>) selector : allSheetIndexes(workbook);
                Map<String, DataBatch> sheets = new LinkedHashMap<>();
                for (Object item : selectors) {
                    Sheet sheet = resolveSheet(workbook, item);
                    sheets.put(sheet.getSheetName(), readSheet(sheet, parser, skipRows, maxRows));
                }
                return BatchReader.of(normalizer.mergeBatches(sheets));
            }

            Sheet sheet = resolveSheet(workbook, selector);
            DataBatch batch = readSheet(sheet, parser, skipRows, maxRows);
            batch.setConstant(ColumnNormalizer.SHEET_NAME, sheet.getSheetName());
            return BatchReader.of(batch);
        }
    }

    @Override
    public void write(DataBatch batch, Path path, Map<String, ?> options) throws IOException {
        Map<String, Object> writeOptions = filterOptions(options, Mode.WRITE);
        String sheetName = stringOption(writeOptions, "sheet_name", DEFAULT_SHEET_NAME);
        boolean header = booleanOption(writeOptions, "header", true);
        boolean index = includeIndex(writeOptions);
        String naRep = stringOption(writeOptions, "na_rep", null);

        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(sheetName);
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd hh:mm:ss"));

            List<String> columns = batch.getColumns();
            int offset = index ? 1 : 0;
            int rowNum = 0;

            if (header) {
                Row headerRow = sheet.createRow(rowNum++);
                if (index) {
                    headerRow.createCell(0).setCellValue(indexLabel(writeOptions));
                }
                for (int c = 0; c < columns.size(); c++) {
                    headerRow.createCell(c + offset).setCellValue(columns.get(c));
                }
            }

            List<Map<String, Object>> rows = batch.getRows();
            for (int r = 0; r < rows.size(); r++) {
                Row row = sheet.createRow(rowNum++);
                if (index) {
                    row.createCell(0).setCellValue(indexValue(batch, r));
                }
                for (int c = 0; c < columns.size(); c++) {
                    setCell(row.createCell(c + offset), rows.get(r).get(columns.get(c)), naRep, dateStyle);
                }
            }

            try (OutputStream out = Files.newOutputStream(path)) {
                workbook.write(out);
            }
        }
        LoggingUtil.debug("Wrote " + batch.size() + " rows to sheet '" + sheetName + "' of " + path);
    }

    private static void setCell(Cell cell, Object value, String naRep, CellStyle dateStyle) {
        if (value == null) {
            if (naRep != null) {
                cell.setCellValue(naRep);
            }
        } else if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            cell.setCellValue((Boolean) value);
        } else if (value instanceof LocalDateTime) {
            cell.setCellValue((LocalDateTime) value);
            cell.setCellStyle(dateStyle);
        } else if (value instanceof LocalDate) {
            cell.setCellValue((LocalDate) value);
            cell.setCellStyle(dateStyle);
        } else {
            cell.setCellValue(value.toString());
        }
    }

    private static void validateSelector(Object selector) {
        if (selector == null || selector instanceof String || selector instanceof Number) {
            return;
        }
        if (selector instanceof List) {
            for (Object item : (List<?>) selector) {
                if (!(item instanceof String || item instanceof Number)) {
                    throw new IllegalArgumentException("Sheet list entries must be sheet indexes or names, got: " + item);
                }
            }
            return;
        }
        throw new IllegalArgumentException("sheet_name must be an integer (sheet index), a string (sheet name), " +
                "a list of those, or null (all sheets). Got " + selector.getClass().getSimpleName() + ": " + selector);
    }

    private static boolean isAllSheets(Object selector) {
        return selector == null || (selector instanceof String && "all".equalsIgnoreCase((String) selector));
    }

    private static List<Integer> allSheetIndexes(Workbook workbook) {
        List<Integer> indexes = new ArrayList<>();
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            indexes.add(i);
        }
        return indexes;
    }

    private static Sheet resolveSheet(Workbook workbook, Object selector) {
        if (selector instanceof Number) {
            int position = ((Number) selector).intValue();
            if (position < 0 || position >= workbook.getNumberOfSheets()) {
                throw new IllegalArgumentException("Sheet index " + position + " out of range, workbook has " +
                        workbook.getNumberOfSheets() + " sheet(s)");
            }
            return workbook.getSheetAt(position);
        }
        Sheet sheet = workbook.getSheet(selector.toString());
        if (sheet == null) {
            throw new IllegalArgumentException("Worksheet named '" + selector + "' not found");
        }
        return sheet;
    }

    /**
     * First non-blank row after the skipped ones is the header; blank rows are ignored.
     */
    private static DataBatch readSheet(Sheet sheet, ValueParser parser, int skipRows, Integer maxRows) {
        List<String> columns = null;
        DataBatch batch = null;
        Map<String, Object> values = new HashMap<>();

        for (int r = skipRows; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null || isBlank(row)) {
                continue;
            }
            if (columns == null) {
                List<String> raw = new ArrayList<>();
                for (int c = 0; c < row.getLastCellNum(); c++) {
                    Object value = cellValue(row.getCell(c), parser);
                    raw.add(value == null ? null : value.toString());
                }
                columns = headerNames(raw);
                batch = new DataBatch(columns);
                continue;
            }
            if (maxRows != null && batch.size() >= maxRows) {
                break;
            }
            values.clear();
            for (int c = 0; c < columns.size(); c++) {
                values.put(columns.get(c), cellValue(row.getCell(c), parser));
            }
            batch.addRow(values);
        }

        if (batch == null) {
            LoggingUtil.warn("Sheet '" + sheet.getSheetName() + "' has no header row");
            return new DataBatch();
        }
        return batch;
    }

    private static boolean isBlank(Row row) {
        for (Cell cell : row) {
            if (cell.getCellType() != CellType.BLANK &&
                    !(cell.getCellType() == CellType.STRING && cell.getStringCellValue().trim().isEmpty())) {
                return false;
            }
        }
        return true;
    }

    private static Object cellValue(Cell cell, ValueParser parser) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                return numericValue(cell.getNumericCellValue(), parser);
            case BOOLEAN:
                return parser.isKeepText() ? String.valueOf(cell.getBooleanCellValue()) : cell.getBooleanCellValue();
            case STRING:
                return parser.parseText(cell.getStringCellValue());
            case ERROR:
                LoggingUtil.debug("Error cell at " + cell.getAddress() + " read as null");
                return null;
            default:
                return null;
        }
    }

    private static Object numericValue(double value, ValueParser parser) {
        Object number;
        if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_INTEGER) {
            number = (long) value;
        } else {
            number = value;
        }
        return parser.isKeepText() ? number.toString() : number;
    }
}
