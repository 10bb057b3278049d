package com.fantasy.anomaly.model;

import com.fantasy.anomaly.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fantasy.anomaly.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnomalyTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void json_usesLowercaseWireValues() throws Exception {
        Anomaly anomaly = TestDataFactory.createAnomaly("a-1", "P-1001", "MIN",
                AnomalyType.PERFORMANCE, Severity.LOW, "Fantasy Points", NOW);

        DocumentContext json = JsonPath.parse(objectMapper.writeValueAsString(anomaly));

        assertThat(json.read("$.type", String.class)).isEqualTo("performance");
        assertThat(json.read("$.severity", String.class)).isEqualTo("low");
        assertThat(json.read("$.impact.recommendedAction", String.class)).isEqualTo("hold");
        assertThat(json.read("$.impact.urgency", String.class)).isEqualTo("this_week");
        assertThat(json.read("$.timestamp", String.class)).isEqualTo("2026-10-19T08:00:00Z");
        assertThat(json.read("$.relatedAnomalyIds", List.class)).isEmpty();
    }

    @Test
    void json_readsBackWithLinks() throws Exception {
        Anomaly anomaly = TestDataFactory.createAnomaly("a-1", "P-1001", "MIN",
                AnomalyType.MARKET, Severity.HIGH, "Ownership %", NOW).toBuilder()
                .relatedAnomalyIds(List.of("a-2", "a-3"))
                .build();

        Anomaly read = objectMapper.readValue(objectMapper.writeValueAsString(anomaly), Anomaly.class);

        assertThat(read).isEqualTo(anomaly);
    }

    @Test
    void enums_acceptWireOrConstantNames() {
        assertThat(Severity.fromValue("critical")).isEqualTo(Severity.CRITICAL);
        assertThat(AnomalyType.fromValue("MARKET")).isEqualTo(AnomalyType.MARKET);
        assertThat(Urgency.fromValue("this_week")).isEqualTo(Urgency.THIS_WEEK);
        assertThatThrownBy(() -> Severity.fromValue("severe"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown severity");
    }

    @Test
    void severity_ordering() {
        assertThat(Severity.HIGH.isAtLeast(Severity.MEDIUM)).isTrue();
        assertThat(Severity.LOW.isAtLeast(Severity.CRITICAL)).isFalse();
    }
}
