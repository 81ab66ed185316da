package net.spookly.gsdk.heartbeat;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Status and body of one heartbeat exchange.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class TransportResponse {
    private final int status;
    private final String body;

    /**
     * Any status of 300 or above counts as a failed exchange.
     */
    public boolean isSuccess() {
        return status < 300;
    }
}
