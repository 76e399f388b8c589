package com.archsketch.core.generator.impl;

import com.archsketch.core.generator.GeneratedReport;
import com.archsketch.core.generator.GeneratorConfig;
import com.archsketch.core.generator.ReportGenerator;
import com.archsketch.core.model.AnalysisDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serialises the full document as pretty-printed JSON.
 *
 * <p>This is the machine-readable output; field order follows the record components.
 */
public class JsonReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonReportGenerator.class);

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "JSON Document";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public GeneratedReport generate(AnalysisDocument document, GeneratorConfig config) {
        try {
            String content = objectMapper.writeValueAsString(document);
            log.debug("Serialised {} document ({} chars)", document.metadata().analysisType(), content.length());
            return new GeneratedReport(config.baseName(), content + "\n", getFileExtension(), "application/json");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise analysis document: " + e.getOriginalMessage(), e);
        }
    }
}
