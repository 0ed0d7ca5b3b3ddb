package com.geodatenbezug.exporter.output;

import com.geodatenbezug.exporter.config.GeodiensteProperties;
import com.geodatenbezug.exporter.model.ProcessingResult;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;

/**
 * Appends one row per processed topic to a daily CSV report.
 *
 * Output path pattern: {outputDir}/processing_results_{date}.csv
 * e.g. /data/reports/processing_results_2024-04-09.csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProcessingReportWriter {

    private final GeodiensteProperties properties;

    static final String[] HEADERS = {
            "topic_title", "base_topic", "canton",
            "code", "reason", "info", "data_path",
            "started_at", "completed_at"
    };

    public synchronized void write(ProcessingResult result) {
        Path outputDir = Paths.get(properties.getReport().getOutputDir());
        Path outputPath = outputDir.resolve(String.format("processing_results_%s.csv", LocalDate.now()));

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            log.warn("Cannot create report directory {}: {}", outputDir, e.getMessage());
            return;
        }

        boolean newFile = !Files.exists(outputPath);
        try (CSVWriter writer = new CSVWriter(
                new FileWriter(outputPath.toFile(), StandardCharsets.UTF_8, true),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (newFile && properties.getReport().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }
            writer.writeNext(toRow(result));

            log.debug("Appended result for {} ({}) to {}", result.getTopicTitle(), result.getCanton(), outputPath);

        } catch (IOException e) {
            // Report rows are best effort
            log.warn("Failed to write processing report {}: {}", outputPath, e.getMessage());
        }
    }

    private String[] toRow(ProcessingResult r) {
        return new String[]{
                str(r.getTopicTitle()),
                str(r.getBaseTopic()),
                str(r.getCanton()),
                str(r.getCode()),
                str(r.getReason()),
                str(r.getInfo()),
                str(r.getDataPath()),
                str(r.getStartedAt()),
                str(r.getCompletedAt())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
