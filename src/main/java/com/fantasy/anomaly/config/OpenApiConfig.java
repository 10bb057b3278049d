package com.fantasy.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI anomalyMonitorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Fantasy Anomaly Monitor API")
                        .version("1.0.0")
                        .description(
                                "Per-player anomaly monitoring for fantasy sports.\n\n" +
                                "**Monitoring Cycle:**\n" +
                                "1. Fetch recent metrics, market and health data per player\n" +
                                "2. Load/create the player's cached baseline (mean / std / seasonal pattern)\n" +
                                "3. Run every enabled detector (statistical, trend, pattern, market, injury risk)\n" +
                                "4. Correlate the cycle's anomalies (same player, same team, or within 1 hour)\n" +
                                "5. Upsert alerts, resolve cleared ones, purge alerts older than 7 days\n" +
                                "6. Publish the complete batch to alert sinks\n\n" +
                                "**Anomaly Types:**\n" +
                                "- `performance`: fantasy point z-score, sustained trends, multi-metric patterns\n" +
                                "- `usage`: snap percentage and target share deviations\n" +
                                "- `market`: ownership rate of change and trade volume spikes\n" +
                                "- `injury`: model-based injury risk from practice, reports and workload")
                        .contact(new Contact().name("Fantasy Analytics Team")));
    }
}
