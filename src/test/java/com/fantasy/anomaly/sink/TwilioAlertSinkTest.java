package com.fantasy.anomaly.sink;

import com.fantasy.anomaly.config.MetricsConfig;
import com.fantasy.anomaly.config.TwilioNotificationConfig;
import com.fantasy.anomaly.model.Anomaly;
import com.fantasy.anomaly.model.AnomalyBatch;
import com.fantasy.anomaly.model.AnomalyType;
import com.fantasy.anomaly.model.Severity;
import com.fantasy.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fantasy.anomaly.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TwilioAlertSinkTest {

    private TwilioNotificationConfig config;
    private TwilioAlertSink sink;

    @BeforeEach
    void setUp() {
        config = new TwilioNotificationConfig();
        config.setFromNumber("+15550001111");
        config.setToNumber("+15550002222");
        sink = spy(new TwilioAlertSink(config, new MetricsConfig(new SimpleMeterRegistry())));
    }

    @Test
    void publish_disabled_sendsNothing() {
        config.setEnabled(false);

        sink.publish(batchOf(anomaly("a-1", Severity.CRITICAL)));

        verify(sink, never()).send(any());
    }

    @Test
    void publish_onlyAnomaliesAtOrAboveMinSeverity() {
        config.setEnabled(true);
        config.setMinSeverity(Severity.HIGH);
        doNothing().when(sink).send(any());
        Anomaly medium = anomaly("a-1", Severity.MEDIUM);
        Anomaly high = anomaly("a-2", Severity.HIGH);
        Anomaly critical = anomaly("a-3", Severity.CRITICAL);

        sink.publish(batchOf(medium, high, critical));

        verify(sink, never()).send(medium);
        verify(sink).send(high);
        verify(sink).send(critical);
    }

    @Test
    void buildMessageBody_summarizesAnomaly() {
        String body = TwilioAlertSink.buildMessageBody(anomaly("a-1", Severity.CRITICAL));

        assertThat(body).startsWith("[ANOMALY ALERT] CRITICAL performance");
        assertThat(body).contains("Player: Player P-1001");
        assertThat(body).contains("Fantasy Points: 40").contains("(expected 16");
        assertThat(body).contains("Action: hold (this_week)");
    }

    private static Anomaly anomaly(String id, Severity severity) {
        return TestDataFactory.createAnomaly(id, "P-1001", "MIN", AnomalyType.PERFORMANCE, severity,
                "Fantasy Points", NOW);
    }

    private static AnomalyBatch batchOf(Anomaly... anomalies) {
        return AnomalyBatch.builder()
                .cycleId(1)
                .anomalies(List.of(anomalies))
                .build();
    }
}
