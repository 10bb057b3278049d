package com.fantasy.anomaly.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test that validates the OpenAPI document structure.
 * Ensures all endpoints and critical schemas are present,
 * protecting dashboard consumers from accidental schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        // Anomaly endpoints
        assertThat(paths).containsKey("/api/v1/anomalies");
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}");
        assertThat(paths).containsKey("/api/v1/anomalies/{anomalyId}/resolve");
        assertThat(paths).containsKey("/api/v1/anomalies/purge");

        // Monitoring loop endpoints
        assertThat(paths).containsKey("/api/v1/monitor");
        assertThat(paths).containsKey("/api/v1/monitor/start");
        assertThat(paths).containsKey("/api/v1/monitor/stop");
        assertThat(paths).containsKey("/api/v1/monitor/cycle");

        // Baseline endpoint
        assertThat(paths).containsKey("/api/v1/baselines/{subjectId}");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("ActiveAlert");
        assertThat(schemas).containsKey("Anomaly");
        assertThat(schemas).containsKey("AnomalyDetails");
        assertThat(schemas).containsKey("AnomalyImpact");
        assertThat(schemas).containsKey("MonitorStatus");
        assertThat(schemas).containsKey("AnomalyBatch");
        assertThat(schemas).containsKey("DetectionConfig");
        assertThat(schemas).containsKey("Baseline");
        assertThat(schemas).containsKey("MonitorStartRequest");
        assertThat(schemas).containsKey("Subject");
    }

    @Test
    void openApiSpec_anomalySchemas_haveRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> anomalyProps = json.read("$.components.schemas.Anomaly.properties");
        assertThat(anomalyProps).containsKey("id");
        assertThat(anomalyProps).containsKey("type");
        assertThat(anomalyProps).containsKey("severity");
        assertThat(anomalyProps).containsKey("confidence");
        assertThat(anomalyProps).containsKey("subjectId");
        assertThat(anomalyProps).containsKey("details");
        assertThat(anomalyProps).containsKey("impact");
        assertThat(anomalyProps).containsKey("timestamp");
        assertThat(anomalyProps).containsKey("relatedAnomalyIds");

        Map<String, Object> impactProps = json.read("$.components.schemas.AnomalyImpact.properties");
        assertThat(impactProps).containsKey("projectionDelta");
        assertThat(impactProps).containsKey("recommendedAction");
        assertThat(impactProps).containsKey("urgency");

        Map<String, Object> batchProps = json.read("$.components.schemas.AnomalyBatch.properties");
        assertThat(batchProps).containsKey("cycleId");
        assertThat(batchProps).containsKey("anomalies");
        assertThat(batchProps).containsKey("failedSubjects");
    }
}
