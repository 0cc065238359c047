package com.propertyintel.gap.output;

import com.propertyintel.gap.config.GapScraperProperties;
import com.propertyintel.gap.model.Candidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes candidates to an Excel workbook, one sheet, amounts as numeric cells.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class XlsxWriter {

    private static final String SHEET_NAME = "candidates";

    private final GapScraperProperties properties;

    public void write(List<Candidate> candidates, Path outputPath) {
        GapScraperProperties.Output cfg = properties.getOutput();
        ExportColumn[] columns = ExportColumn.values();

        try (Workbook wb = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(outputPath)) {
            Sheet sheet = wb.createSheet(SHEET_NAME);
            int r = 0;

            if (cfg.isIncludeHeader()) {
                CellStyle bold = wb.createCellStyle();
                Font font = wb.createFont();
                font.setBold(true);
                bold.setFont(font);

                Row header = sheet.createRow(r++);
                String[] labels = ExportColumn.headers(cfg.getLocale());
                for (int c = 0; c < labels.length; c++) {
                    Cell cell = header.createCell(c);
                    cell.setCellValue(labels[c]);
                    cell.setCellStyle(bold);
                }
                sheet.createFreezePane(0, 1);
            }

            for (Candidate candidate : candidates) {
                Row row = sheet.createRow(r++);
                for (int c = 0; c < columns.length; c++) {
                    setCell(row.createCell(c), columns[c].value(candidate));
                }
            }

            wb.write(out);
            log.info("Written {} candidates to XLSX: {}", candidates.size(), outputPath);

        } catch (IOException e) {
            log.error("Failed to write XLSX file {}: {}", outputPath, e.getMessage(), e);
            throw new ExportException("XLSX write failed: " + outputPath, e);
        }
    }

    private void setCell(Cell cell, Object value) {
        if (value == null || "".equals(value)) {
            cell.setBlank();
        } else if (value instanceof Number n) {
            cell.setCellValue(n.doubleValue());
        } else {
            cell.setCellValue(value.toString());
        }
    }
}
