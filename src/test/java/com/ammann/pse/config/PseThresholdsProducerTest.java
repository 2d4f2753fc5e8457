/* (C)2026 */
package com.ammann.pse.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.pse.dto.PseAnalysisDTO;
import com.ammann.pse.dto.PseAnalysisRequestDTO;
import com.ammann.pse.enumeration.RiskLevel;
import com.ammann.pse.service.PseAnalysisService;
import com.ammann.pse.support.TestDataFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

@QuarkusTest
class PseThresholdsProducerTest {

    @Inject PseThresholds thresholds;

    @Inject PseAnalysisService analysisService;

    @Inject MeterRegistry meterRegistry;

    @Test
    void producesThresholdsFromConfiguration() {
        assertThat(thresholds.maxSafeFlashRate()).isEqualTo(3.0);
        assertThat(thresholds.redMergeTolerance()).isEqualTo(0.05);
        assertThat(thresholds.highSaturationEventLimit()).isEqualTo(12);
    }

    @Test
    void injectedPipelineAnalysesAndRecordsMetrics() {
        PseAnalysisDTO analysis = analysisService.analyze(
                PseAnalysisRequestDTO.of(TestDataFactory.strobe(50, 2, 5), null));

        assertThat(analysis.pseRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(meterRegistry.find("pse_analyses_total").tag("risk_level", "high").counter())
                .isNotNull();
        assertThat(meterRegistry.find("pse_analysis_duration").timer()).isNotNull();
    }
}
