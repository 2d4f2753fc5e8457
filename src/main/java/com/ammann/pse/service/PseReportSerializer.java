/* (C)2026 */
package com.ammann.pse.service;

import com.ammann.pse.dto.PseAnalysisDTO;
import com.ammann.pse.exception.ReportSerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Renders analysis results as snake_case JSON for report storage.
 */
@ApplicationScoped
public class PseReportSerializer {

    private static final Logger LOG = Logger.getLogger(PseReportSerializer.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    /**
     * Serialises the analysis to compact JSON.
     *
     * @throws ReportSerializationException if Jackson cannot render the result
     */
    public String toJson(PseAnalysisDTO analysis) {
        try {
            String json = JSON_MAPPER.writeValueAsString(analysis);
            LOG.debugf("Serialised PSE report (%d chars)", json.length());
            return json;
        } catch (JsonProcessingException e) {
            throw new ReportSerializationException("Failed to serialise PSE analysis report", e);
        }
    }

    /**
     * Serialises the analysis to indented JSON.
     *
     * @throws ReportSerializationException if Jackson cannot render the result
     */
    public String toPrettyJson(PseAnalysisDTO analysis) {
        try {
            return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(analysis);
        } catch (JsonProcessingException e) {
            throw new ReportSerializationException("Failed to serialise PSE analysis report", e);
        }
    }
}
