package com.z254.hivemind.dispatch.messaging;

import lombok.Getter;

/**
 * The durable write of a message still failed after every retry.
 */
@Getter
public class MessageDeliveryException extends RuntimeException {

    private final String recipient;
    private final String messageId;

    public MessageDeliveryException(String recipient, String messageId, long attempts, Throwable cause) {
        super("Durable delivery of message " + messageId + " to " + recipient
                + " failed after " + attempts + " attempts", cause);
        this.recipient = recipient;
        this.messageId = messageId;
    }
}
