package com.mk.fx.qa.load.generator.rest;

import java.util.Objects;

/**
 * Outcome of one GET request: either a status code from a received response or a transport
 * failure. Exactly one of the two is present.
 *
 * @param statusCode HTTP status code, {@code -1} when no response was received
 * @param failure the transport failure, {@code null} when a response was received
 */
public record TransportResult(int statusCode, TransportFailure failure) {

    public static final int NO_STATUS = -1;

    public TransportResult {
        if (failure == null && statusCode < 0) {
            throw new IllegalArgumentException("A response result needs a status code");
        }
        if (failure != null && statusCode != NO_STATUS) {
            throw new IllegalArgumentException("A failed result cannot carry a status code");
        }
    }

    public static TransportResult response(int statusCode) {
        return new TransportResult(statusCode, null);
    }

    public static TransportResult failed(TransportFailure failure) {
        return new TransportResult(NO_STATUS, Objects.requireNonNull(failure, "failure"));
    }

    /** True when the server answered, whatever the status code. */
    public boolean hasResponse() {
        return failure == null;
    }

    /** True for a received response with a status in {@code [200, 400)}. */
    public boolean isSuccess() {
        return hasResponse() && statusCode >= 200 && statusCode < 400;
    }
}
