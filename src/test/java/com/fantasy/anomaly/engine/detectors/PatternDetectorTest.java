package com.fantasy.anomaly.engine.detectors;

import com.fantasy.anomaly.config.AnomalyThresholdConfig;
import com.fantasy.anomaly.engine.model.ModelInferenceException;
import com.fantasy.anomaly.engine.model.ReconstructionModel;
import com.fantasy.anomaly.engine.model.SmoothingReconstructionModel;
import com.fantasy.anomaly.model.*;
import com.fantasy.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.fantasy.anomaly.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PatternDetectorTest {

    @Mock
    private ReconstructionModel model;

    private PatternDetector detector;
    private Subject subject;
    private SubjectMetrics metrics;

    @BeforeEach
    void setUp() {
        detector = new PatternDetector(model, new AnomalyThresholdConfig());
        subject = TestDataFactory.createSubject("P-1001", "MIN");
        metrics = TestDataFactory.createMetrics("P-1001", List.of(12.0, 18.0, 15.0, 20.0, 9.0));
    }

    @Test
    void detectComplex_errorAboveTrigger_medium() {
        stubReconstructionError(0.4);

        Optional<Anomaly> result = detector.detectComplex(subject, metrics, NOW);

        assertThat(result).isPresent();
        Anomaly anomaly = result.get();
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(anomaly.getConfidence()).isCloseTo(0.4, within(1e-9));
        assertThat(anomaly.getDescription()).isEqualTo("Unusual performance pattern detected");
        assertThat(anomaly.getDetails().getMetric()).isEqualTo("Performance Pattern");
        assertThat(anomaly.getDetails().getExpectedValue()).isEqualTo(0.1);
        assertThat(anomaly.getImpact().getRecommendedAction()).isEqualTo(RecommendedAction.MONITOR);
        assertThat(anomaly.getImpact().getProjectionDelta()).isCloseTo(-1.2, within(1e-9));
    }

    @Test
    void detectComplex_errorAboveHigh_high() {
        stubReconstructionError(0.7);

        Optional<Anomaly> result = detector.detectComplex(subject, metrics, NOW);

        assertThat(result).isPresent();
        assertThat(result.get().getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void detectComplex_largeError_confidenceCapped() {
        stubReconstructionError(1.44);

        assertThat(detector.detectComplex(subject, metrics, NOW))
                .hasValueSatisfying(a -> assertThat(a.getConfidence()).isEqualTo(1.0));
    }

    @Test
    void detectComplex_smallError_noAnomaly() {
        stubReconstructionError(0.09);

        assertThat(detector.detectComplex(subject, metrics, NOW)).isEmpty();
    }

    @Test
    void detectComplex_wrongOutputLength_throwsModelInferenceException() {
        when(model.encodeDecode(any())).thenReturn(new double[3]);

        assertThatThrownBy(() -> detector.detectComplex(subject, metrics, NOW))
                .isInstanceOf(ModelInferenceException.class)
                .hasMessageContaining("expected 25");
    }

    @Test
    void detectComplex_nonFiniteOutput_throwsModelInferenceException() {
        double[] reconstruction = new double[25];
        reconstruction[0] = Double.NaN;
        when(model.encodeDecode(any())).thenReturn(reconstruction);

        assertThatThrownBy(() -> detector.detectComplex(subject, metrics, NOW))
                .isInstanceOf(ModelInferenceException.class);
    }

    @Test
    void detectComplex_modelThrows_wrapped() {
        when(model.encodeDecode(any())).thenThrow(new IllegalStateException("weights not loaded"));

        assertThatThrownBy(() -> detector.detectComplex(subject, metrics, NOW))
                .isInstanceOf(ModelInferenceException.class)
                .hasMessageContaining("weights not loaded")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void detectComplex_defaultModel_flagsMetricsSwingingTogether() {
        PatternDetector withDefaultModel = new PatternDetector(new SmoothingReconstructionModel(), new AnomalyThresholdConfig());
        List<Double> zigzag = List.of(1.0, -1.0, 1.0, -1.0, 1.0);
        SubjectMetrics swinging = SubjectMetrics.builder()
                .subjectId("P-1001")
                .fantasyPoints(zigzag)
                .snapPercentage(zigzag)
                .targets(zigzag)
                .touches(zigzag)
                .efficiency(zigzag)
                .build();

        Optional<Anomaly> result = withDefaultModel.detectComplex(subject, swinging, NOW);

        assertThat(result).isPresent();
        assertThat(result.get().getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void detectComplex_defaultModel_steadyProgressionNotFlagged() {
        PatternDetector withDefaultModel = new PatternDetector(new SmoothingReconstructionModel(), new AnomalyThresholdConfig());
        List<Double> rising = List.of(1.0, 2.0, 3.0, 4.0, 5.0);
        SubjectMetrics steady = SubjectMetrics.builder()
                .subjectId("P-1001")
                .fantasyPoints(rising)
                .snapPercentage(rising)
                .targets(rising)
                .touches(rising)
                .efficiency(rising)
                .build();

        assertThat(withDefaultModel.detectComplex(subject, steady, NOW)).isEmpty();
    }

    // Shift every feature by the same amount so the MSE equals the requested error.
    private void stubReconstructionError(double error) {
        double shift = Math.sqrt(error);
        when(model.encodeDecode(any())).thenAnswer(invocation -> {
            double[] features = invocation.getArgument(0);
            double[] out = features.clone();
            for (int i = 0; i < out.length; i++) {
                out[i] += shift;
            }
            return out;
        });
    }
}
