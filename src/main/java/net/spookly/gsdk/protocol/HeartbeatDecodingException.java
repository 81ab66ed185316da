package net.spookly.gsdk.protocol;

/**
 * Raised when a heartbeat response body cannot be decoded. No state has been applied when this is thrown.
 */
public final class HeartbeatDecodingException extends Exception {
    private static final long serialVersionUID = 1L;

    public HeartbeatDecodingException(String message) {
        super(message);
    }

    public HeartbeatDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
