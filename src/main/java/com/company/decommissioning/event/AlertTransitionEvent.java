package com.company.decommissioning.event;

import com.company.decommissioning.domain.NotificationEvent;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AlertTransitionEvent {
    private final NotificationEvent notification;
}
