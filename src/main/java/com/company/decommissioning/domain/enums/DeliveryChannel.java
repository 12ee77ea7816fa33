package com.company.decommissioning.domain.enums;

public enum DeliveryChannel {
    WEBHOOK,
    ISSUE_TRACKER
}
