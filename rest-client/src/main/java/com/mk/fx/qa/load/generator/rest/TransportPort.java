package com.mk.fx.qa.load.generator.rest;

import java.time.Duration;

/**
 * Issues a single GET request and reports what came back. Implementations must not throw for
 * transport problems: connection errors, timeouts, resolution and protocol errors are returned as a
 * {@link TransportFailure} inside the {@link TransportResult}.
 */
@FunctionalInterface
public interface TransportPort {

    /**
     * Sends one GET request.
     *
     * @param host target host, optionally with a port and/or a scheme
     * @param path request path starting with {@code /}
     * @param timeout overall request timeout
     * @return the response status code or the transport failure
     */
    TransportResult get(String host, String path, Duration timeout);
}
