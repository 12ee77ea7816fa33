package com.company.decommissioning.source;

import com.company.decommissioning.domain.ActivitySnapshot;
import com.company.decommissioning.exception.MetricFetchException;

import java.time.Duration;

/**
 * Pull-based access to per-database activity telemetry produced by an external exporter.
 */
public interface ActivityMetricSource {

    /**
     * @param window look-back window ending now
     * @return the latest activity and sample count, or {@link ActivitySnapshot#noData()}
     *         when the window holds no samples
     * @throws MetricFetchException when the backend cannot be reached
     */
    ActivitySnapshot fetchActivity(String databaseId, Duration window);
}
