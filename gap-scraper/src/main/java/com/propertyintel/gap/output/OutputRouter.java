package com.propertyintel.gap.output;

import com.propertyintel.gap.config.GapScraperProperties;
import com.propertyintel.gap.model.Candidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

/**
 * Routes candidates to the configured sink(s).
 * Supports CSV, XLSX, or BOTH modes; an empty result writes nothing.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String BASE_NAME = "listings_gap_";

    private final CsvWriter csvWriter;
    private final XlsxWriter xlsxWriter;
    private final GapScraperProperties properties;

    /**
     * @return path of the primary file written (the XLSX one in BOTH mode),
     *         or empty when there was nothing to write
     */
    public Optional<Path> write(List<Candidate> candidates) {
        return write(candidates, LocalDateTime.now());
    }

    Optional<Path> write(List<Candidate> candidates, LocalDateTime at) {
        if (candidates.isEmpty()) {
            log.info("No candidates to export");
            return Optional.empty();
        }

        Path dir = ensureDir(properties.getOutput().getOutputDir());
        String base = BASE_NAME + at.format(STAMP);
        Path csv = dir.resolve(base + ".csv");
        Path xlsx = dir.resolve(base + ".xlsx");

        GapScraperProperties.Output.OutputMode mode = properties.getOutput().getMode();
        return switch (mode) {
            case CSV -> {
                csvWriter.write(candidates, csv);
                yield Optional.of(csv);
            }
            case XLSX -> {
                xlsxWriter.write(candidates, xlsx);
                yield Optional.of(xlsx);
            }
            case BOTH -> {
                csvWriter.write(candidates, csv);
                xlsxWriter.write(candidates, xlsx);
                yield Optional.of(xlsx);
            }
        };
    }

    private Path ensureDir(String dirPath) {
        Path dir = Paths.get(dirPath);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ExportException("Cannot create output directory " + dir, e);
        }
        return dir;
    }
}
