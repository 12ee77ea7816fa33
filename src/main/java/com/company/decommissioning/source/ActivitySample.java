package com.company.decommissioning.source;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One exporter sample as stored in the activity sorted set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActivitySample {
    /** Epoch millis. */
    private long timestamp;
    private long activeConnections;
    private long queryCount;

    @JsonIgnore
    public boolean isActive() {
        return activeConnections > 0 || queryCount > 0;
    }
}
