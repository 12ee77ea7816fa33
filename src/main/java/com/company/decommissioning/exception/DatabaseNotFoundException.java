package com.company.decommissioning.exception;

public class DatabaseNotFoundException extends RuntimeException {
    public DatabaseNotFoundException(String databaseId) {
        super("Database not monitored: " + databaseId);
    }
}
