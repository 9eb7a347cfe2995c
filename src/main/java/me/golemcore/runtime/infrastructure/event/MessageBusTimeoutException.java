package me.golemcore.runtime.infrastructure.event;

/**
 * Raised (as the exceptional completion of a request future) when no matching
 * response arrived in time.
 */
public class MessageBusTimeoutException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MessageBusTimeoutException(String message) {
        super(message);
    }
}
