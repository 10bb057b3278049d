package com.fantasy.anomaly.provider;

import com.fantasy.anomaly.model.MarketData;

public interface MarketDataProvider {

    MarketData get(String subjectId);
}
