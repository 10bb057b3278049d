package com.fantasy.anomaly.seeder;

import com.fantasy.anomaly.provider.HealthDataProvider;
import com.fantasy.anomaly.provider.MarketDataProvider;
import com.fantasy.anomaly.provider.MetricsProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "anomaly.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SyntheticProviderConfig {

    @Bean
    public MetricsProvider syntheticMetricsProvider(SyntheticSubjectData data) {
        return data::metrics;
    }

    @Bean
    public MarketDataProvider syntheticMarketDataProvider(SyntheticSubjectData data) {
        return data::market;
    }

    @Bean
    public HealthDataProvider syntheticHealthDataProvider(SyntheticSubjectData data) {
        return data::health;
    }
}
