package com.fantasy.anomaly.repository;

import com.fantasy.anomaly.model.Baseline;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryBaselineStore implements BaselineStore {

    private final ConcurrentHashMap<String, Baseline> baselines = new ConcurrentHashMap<>();

    @Override
    public Optional<Baseline> find(String subjectId) {
        return Optional.ofNullable(baselines.get(subjectId));
    }

    @Override
    public void save(Baseline baseline) {
        baselines.put(baseline.getSubjectId(), baseline);
    }

    @Override
    public boolean delete(String subjectId) {
        return baselines.remove(subjectId) != null;
    }

    @Override
    public int size() {
        return baselines.size();
    }
}
