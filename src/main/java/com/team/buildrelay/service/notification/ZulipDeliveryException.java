package com.team.buildrelay.service.notification;

/**
 * Raised when Zulip does not accept a message: non-2xx response, timeout or
 * connection failure. Delivery is not retried.
 */
public class ZulipDeliveryException extends RuntimeException {

    private final int statusCode;

    public ZulipDeliveryException(int statusCode, String responseBody) {
        super("Failed to send message to Zulip: " + statusCode + " - " + responseBody);
        this.statusCode = statusCode;
    }

    public ZulipDeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status returned by Zulip, or -1 if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
