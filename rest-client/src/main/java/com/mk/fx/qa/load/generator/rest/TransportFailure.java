package com.mk.fx.qa.load.generator.rest;

import java.util.Objects;

/**
 * A request that produced no HTTP response.
 *
 * @param type classified cause
 * @param message root cause message, never {@code null}
 */
public record TransportFailure(FailureType type, String message) {

    public TransportFailure {
        Objects.requireNonNull(type, "type");
        message = message == null ? type.name() : message;
    }

    public static TransportFailure from(Throwable t) {
        var type = FailureType.classify(t);
        var root = FailureType.rootCause(t);
        String msg = t != null ? t.getMessage() : null;
        if (msg == null && root != null) {
            msg = root.getMessage();
        }
        if (msg == null && root != null) {
            msg = root.getClass().getSimpleName() + " occurred";
        }
        return new TransportFailure(type, msg);
    }
}
