package dev.roshin.treescan.analysis.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.roshin.treescan.analysis.model.AnalysisReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes {@link AnalysisReport}s to JSON for the persistence and report layers.
 */
public final class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .build();

    public String toJson(AnalysisReport<?> report) {
        try {
            return MAPPER.writeValueAsString(report.toRecord());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Report metrics are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    public void write(AnalysisReport<?> report, Path target) throws IOException {
        Files.writeString(target, toJson(report), StandardCharsets.UTF_8);
        log.info("Wrote report for {} to {}", report.root(), target);
    }
}
