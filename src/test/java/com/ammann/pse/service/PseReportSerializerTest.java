package com.ammann.pse.service;

import com.ammann.pse.config.PseThresholds;
import com.ammann.pse.dto.PseAnalysisDTO;
import com.ammann.pse.dto.PseAnalysisRequestDTO;
import com.ammann.pse.support.TestDataFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PseReportSerializerTest
{

    private final PseReportSerializer serializer = new PseReportSerializer();
    private final PseAnalysisService service = TestDataFactory.analysisService(PseThresholds.defaults(), null);
    private final ObjectMapper reader = new ObjectMapper();

    @Test
    void rendersSnakeCaseWithLowercaseLabels() throws Exception
    {
        PseAnalysisDTO analysis = service.analyze(
                PseAnalysisRequestDTO.of(TestDataFactory.strobe(50, 2, 5), List.of()));

        JsonNode json = reader.readTree(serializer.toJson(analysis));

        assertThat(json.get("pse_risk_level").asText()).isEqualTo("high");
        assertThat(json.get("overall_risk_score").asDouble()).isEqualTo(70.0);
        assertThat(json.get("safe_for_broadcast").asBoolean()).isFalse();
        assertThat(json.get("broadcast_compliance").has("itu_r_bt1702_compliant")).isTrue();
        assertThat(json.get("broadcast_compliance").has("ebu_tech3253_compliant")).isTrue();

        JsonNode flash = json.get("flash_analysis");
        assertThat(flash.get("statistics").get("total_flashes").asInt()).isEqualTo(10);
        assertThat(flash.get("pattern").get("pattern_type").asText()).isEqualTo("regular_strobe");
        assertThat(flash.get("pattern").get("frequency_bands").get("3-5Hz").asInt()).isEqualTo(2);
        assertThat(flash.get("events").get(0).get("kind").asText()).isEqualTo("sudden");
        assertThat(flash.get("dangerous_periods").get(0).get("risk_level").asText()).isEqualTo("high");
    }

    @Test
    void omitsAbsentSections() throws Exception
    {
        PseAnalysisDTO analysis = service.analyze(
                PseAnalysisRequestDTO.of(TestDataFactory.constantLuminance(10, 1.0), List.of()));

        JsonNode json = reader.readTree(serializer.toJson(analysis));

        assertThat(json.get("flash_analysis").has("flash_intensity")).isFalse();
        assertThat(json.get("flash_analysis").get("pattern").has("rhythm_frequency")).isFalse();
        assertThat(json.get("metadata").get("standards_version").asText())
                .isEqualTo(PseAnalysisService.STANDARDS_VERSION);
    }

    @Test
    void prettyOutputIsEquivalent() throws Exception
    {
        PseAnalysisDTO analysis = service.analyze(
                PseAnalysisRequestDTO.of(TestDataFactory.strobe(50, 2, 5), List.of()));

        String pretty = serializer.toPrettyJson(analysis);

        assertThat(pretty).contains("\n");
        assertThat(reader.readTree(pretty)).isEqualTo(reader.readTree(serializer.toJson(analysis)));
    }
}
