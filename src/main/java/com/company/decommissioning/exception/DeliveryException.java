package com.company.decommissioning.exception;

import com.company.decommissioning.domain.enums.DeliveryChannel;

public class DeliveryException extends RuntimeException {

    private final DeliveryChannel channel;

    public DeliveryException(DeliveryChannel channel, String message) {
        super(message);
        this.channel = channel;
    }

    public DeliveryException(DeliveryChannel channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public DeliveryChannel getChannel() {
        return channel;
    }
}
