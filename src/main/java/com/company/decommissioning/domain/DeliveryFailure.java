package com.company.decommissioning.domain;

import com.company.decommissioning.domain.enums.DeliveryChannel;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class DeliveryFailure {
    String databaseId;
    DeliveryChannel channel;
    String transitionKey;
    int attempts;
    String lastError;
    Instant failedAt;
}
