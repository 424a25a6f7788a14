package com.labelops.core.output;

import com.labelops.TestFixtures;
import com.labelops.config.MappingField;
import com.labelops.config.TemplateMapping;
import com.labelops.core.parse.AddressRecord;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClickDropWorkbookWriterTest {

    @TempDir
    Path tempDir;

    private static AddressRecord record(String name, String postcode) {
        return new AddressRecord(name, "10 High Street", "", "Stonehaven", "Aberdeenshire", postcode,
            "united kingdom", "Tracked 48", 0.5, "ACME-1", "", "", "", false);
    }

    @Test
    void writesMappedColumnsIntoCopyOfTemplate() throws Exception {
        Path template = TestFixtures.blankTemplate(tempDir.resolve("template.xlsx"));
        byte[] templateBytes = Files.readAllBytes(template);
        Path ready = tempDir.resolve("READY_XLSX");

        Path written = new ClickDropWorkbookWriter().write(
            List.of(record("Grace O'Neil", "ab53 8hy"), record("Martin Wilkie", "CF64 4BU")),
            TemplateMapping.clickAndDrop(), template, ready, "batch.xlsx");

        assertEquals(ready.resolve("batch.xlsx"), written);
        assertArrayEquals(templateBytes, Files.readAllBytes(template));
        try (InputStream in = Files.newInputStream(written);
             XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            Sheet sheet = workbook.getSheetAt(0);
            Row first = sheet.getRow(0);
            assertEquals("Grace O'Neil", first.getCell(0).getStringCellValue());
            assertEquals("10 High Street", first.getCell(1).getStringCellValue());
            assertNull(first.getCell(2));
            assertEquals("AB53 8HY", first.getCell(5).getStringCellValue());
            assertEquals("UNITED KINGDOM", first.getCell(6).getStringCellValue());
            assertEquals(CellType.NUMERIC, first.getCell(8).getCellType());
            assertEquals(0.5, first.getCell(8).getNumericCellValue());
            assertEquals("ACME-1", first.getCell(9).getStringCellValue());
            assertEquals("Martin Wilkie", sheet.getRow(1).getCell(0).getStringCellValue());
        }
        try (Stream<Path> files = Files.list(ready)) {
            assertEquals(1, files.count(), "no temporary file is left behind");
        }
    }

    @Test
    void appendsBelowRowsAlreadyInTheTemplate() throws Exception {
        Path template = tempDir.resolve("prefilled.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             OutputStream out = Files.newOutputStream(template)) {
            workbook.createSheet("Sheet1").createRow(0).createCell(0).setCellValue("Existing");
            workbook.write(out);
        }

        Path written = new ClickDropWorkbookWriter().write(List.of(record("Grace O'Neil", "AB53 8HY")),
            TemplateMapping.clickAndDrop(), template, tempDir, "out.xlsx");

        try (InputStream in = Files.newInputStream(written);
             XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            Sheet sheet = workbook.getSheetAt(0);
            assertEquals("Existing", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("Grace O'Neil", sheet.getRow(1).getCell(0).getStringCellValue());
        }
    }

    @Test
    void honoursCustomColumnPositions() throws Exception {
        Path template = TestFixtures.blankTemplate(tempDir.resolve("template.xlsx"));
        TemplateMapping mapping = TemplateMapping.clickAndDrop()
            .with(MappingField.FULL_NAME, 12)
            .with(MappingField.PHONE, 11);

        Path written = new ClickDropWorkbookWriter().write(List.of(record("Grace O'Neil", "AB53 8HY")),
            mapping, template, tempDir, "custom.xlsx");

        try (InputStream in = Files.newInputStream(written);
             XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            Row row = workbook.getSheetAt(0).getRow(0);
            assertEquals("Grace O'Neil", row.getCell(11).getStringCellValue());
            assertNull(row.getCell(0));
            assertNull(row.getCell(10), "empty values leave the cell untouched");
        }
    }

    @Test
    void missingTemplateFailsWithoutOutput() {
        Path ready = tempDir.resolve("READY_XLSX");

        OutputWriteException ex = assertThrows(OutputWriteException.class, () -> new ClickDropWorkbookWriter().write(
            List.of(record("Grace O'Neil", "AB53 8HY")), TemplateMapping.clickAndDrop(),
            tempDir.resolve("missing.xlsx"), ready, "batch.xlsx"));

        assertTrue(ex.getMessage().startsWith("Template not found"));
        assertFalse(Files.exists(ready.resolve("batch.xlsx")));
    }
}
