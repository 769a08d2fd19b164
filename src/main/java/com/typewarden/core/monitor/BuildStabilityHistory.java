package com.typewarden.core.monitor;

import com.typewarden.core.config.CampaignProperties;
import com.typewarden.core.persistence.BoundedHistory;
import com.typewarden.core.persistence.HistoryStore;
import com.typewarden.core.persistence.JsonFileHistoryStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Capped log of build probes, newest last.
 */
@Service
public class BuildStabilityHistory {

    private final BoundedHistory<BuildStabilityRecord> records;

    @Autowired
    public BuildStabilityHistory(CampaignProperties properties) {
        this(properties.getHistory().getBuildStabilityCapacity(),
                new JsonFileHistoryStore<>(
                        Path.of(properties.getHistory().getDirectory(), "build-stability.json"),
                        BuildStabilityRecord.class));
    }

    public BuildStabilityHistory(int capacity, HistoryStore<BuildStabilityRecord> store) {
        this.records = new BoundedHistory<>(capacity, store);
    }

    public void record(BuildStabilityRecord record) {
        records.append(record);
    }

    public BuildStabilityRecord latest() {
        return records.latest();
    }

    public List<BuildStabilityRecord> snapshot() {
        return records.snapshot();
    }

    /** Length of the trailing run of unstable probes. */
    public int consecutiveFailures() {
        List<BuildStabilityRecord> all = records.snapshot();
        int count = 0;
        for (int i = all.size() - 1; i >= 0 && !all.get(i).stable(); i--) {
            count++;
        }
        return count;
    }

    public BuildStabilitySummary summary() {
        List<BuildStabilityRecord> all = records.snapshot();
        if (all.isEmpty()) {
            return new BuildStabilitySummary(null, 0, 100.0, 0.0, 0);
        }
        long stable = all.stream().filter(BuildStabilityRecord::stable).count();
        double averageMs = all.stream().mapToLong(BuildStabilityRecord::buildTimeMs).average().orElse(0.0);
        return new BuildStabilitySummary(all.get(all.size() - 1), consecutiveFailures(),
                stable * 100.0 / all.size(), averageMs, all.size());
    }
}
