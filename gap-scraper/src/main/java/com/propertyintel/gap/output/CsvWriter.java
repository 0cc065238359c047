package com.propertyintel.gap.output;

import com.opencsv.CSVWriter;
import com.propertyintel.gap.config.GapScraperProperties;
import com.propertyintel.gap.model.Candidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes candidates to a UTF-8 CSV file.
 *
 * A byte-order mark is written first so spreadsheet tools detect the
 * encoding of the Korean headers.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    private static final char BOM = '\uFEFF';

    private final GapScraperProperties properties;

    public void write(List<Candidate> candidates, Path outputPath) {
        GapScraperProperties.Output cfg = properties.getOutput();

        try (Writer out = new OutputStreamWriter(Files.newOutputStream(outputPath), StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            out.write(BOM);
            if (cfg.isIncludeHeader()) {
                writer.writeNext(ExportColumn.headers(cfg.getLocale()));
            }
            for (Candidate c : candidates) {
                writer.writeNext(toRow(c));
            }

            log.info("Written {} candidates to CSV: {}", candidates.size(), outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new ExportException("CSV write failed: " + outputPath, e);
        }
    }

    String[] toRow(Candidate c) {
        ExportColumn[] columns = ExportColumn.values();
        String[] row = new String[columns.length];
        for (int i = 0; i < columns.length; i++) {
            row[i] = str(columns[i].value(c));
        }
        return row;
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
