package com.labelops.core.output;

import com.labelops.config.MappingField;
import com.labelops.config.TemplateMapping;
import com.labelops.core.parse.AddressRecord;
import com.labelops.logging.AppLogger;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Fills a copy of the Click &amp; Drop import template. The template itself is only read.
 */
public final class ClickDropWorkbookWriter {
    private static final Logger LOGGER = AppLogger.get();

    public Path write(List<AddressRecord> records,
                      TemplateMapping mapping,
                      Path templatePath,
                      Path readyDir,
                      String fileName) throws OutputWriteException {
        StagedFile staged = stage(records, mapping, templatePath, readyDir, fileName);
        StagedFile.commitAll(List.of(staged));
        return staged.target();
    }

    /**
     * Writes the filled workbook to a hidden temporary file next to its final path in
     * {@code readyDir}. Nothing appears under the final name until the result is committed.
     */
    public StagedFile stage(List<AddressRecord> records,
                            TemplateMapping mapping,
                            Path templatePath,
                            Path readyDir,
                            String fileName) throws OutputWriteException {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(mapping, "mapping");
        if (templatePath == null || !Files.isRegularFile(templatePath)) {
            throw new OutputWriteException("Template not found: " + templatePath);
        }

        Path target = readyDir.resolve(fileName);
        Path temp = AtomicFiles.tempSibling(target);
        try (InputStream in = Files.newInputStream(templatePath);
             XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            Sheet sheet = workbook.getNumberOfSheets() == 0 ? workbook.createSheet("Sheet1") : workbook.getSheetAt(0);
            int rowIndex = firstEmptyRow(sheet, mapping);
            int startRow = rowIndex;
            for (AddressRecord record : records) {
                Row row = sheet.getRow(rowIndex);
                if (row == null) {
                    row = sheet.createRow(rowIndex);
                }
                fillRow(row, record, mapping);
                rowIndex++;
            }

            Files.createDirectories(readyDir);
            try (OutputStream out = Files.newOutputStream(temp)) {
                workbook.write(out);
            }
            LOGGER.fine("Staged %d row(s) from row %d for %s".formatted(records.size(), startRow + 1, target.getFileName()));
            return new StagedFile(temp, target);
        } catch (IOException | RuntimeException ex) {
            StagedFile.deleteQuietly(temp);
            throw new OutputWriteException("Failed to write workbook %s: %s".formatted(fileName, ex.getMessage()), ex);
        }
    }

    /**
     * First row whose mapped cells are all blank, so rows already in the template are kept.
     */
    static int firstEmptyRow(Sheet sheet, TemplateMapping mapping) {
        int last = sheet.getLastRowNum();
        for (int index = 0; index <= last; index++) {
            Row row = sheet.getRow(index);
            if (row == null || isBlank(row, mapping)) {
                return index;
            }
        }
        return last + 1;
    }

    private static boolean isBlank(Row row, TemplateMapping mapping) {
        for (Integer column : mapping.columns().values()) {
            Cell cell = row.getCell(column - 1);
            if (cell == null || cell.getCellType() == CellType.BLANK) {
                continue;
            }
            if (cell.getCellType() == CellType.STRING && cell.getStringCellValue().isBlank()) {
                continue;
            }
            return false;
        }
        return true;
    }

    private static void fillRow(Row row, AddressRecord record, TemplateMapping mapping) {
        for (Map.Entry<MappingField, Integer> entry : mapping.columns().entrySet()) {
            MappingField field = entry.getKey();
            int columnIndex = entry.getValue() - 1;
            if (field == MappingField.WEIGHT_KG) {
                if (record.weightKg() != null) {
                    row.createCell(columnIndex, CellType.NUMERIC).setCellValue(record.weightKg());
                }
                continue;
            }
            String value = record.value(field);
            if (field == MappingField.POSTCODE || field == MappingField.COUNTRY) {
                value = value.toUpperCase(Locale.ROOT);
            }
            if (!value.isEmpty()) {
                row.createCell(columnIndex, CellType.STRING).setCellValue(value);
            }
        }
    }
}
