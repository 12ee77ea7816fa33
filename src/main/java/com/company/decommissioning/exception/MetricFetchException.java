package com.company.decommissioning.exception;

public class MetricFetchException extends RuntimeException {
    public MetricFetchException(String databaseId, Throwable cause) {
        super("Failed to fetch activity for database " + databaseId, cause);
    }
}
