package com.company.decommissioning.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Result of one metric fetch: the latest non-zero activity seen and how many samples the
 * window held, or no data at all.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ActivitySnapshot {

    private static final ActivitySnapshot NO_DATA = new ActivitySnapshot(null, 0, true);

    /** Null when the source has never seen activity for this database. */
    private final Instant lastActiveAt;
    private final long sampleCount;
    private final boolean noData;

    public static ActivitySnapshot of(Instant lastActiveAt, long sampleCount) {
        return new ActivitySnapshot(lastActiveAt, sampleCount, false);
    }

    public static ActivitySnapshot noData() {
        return NO_DATA;
    }
}
