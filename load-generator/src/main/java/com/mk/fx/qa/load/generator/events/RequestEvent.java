package com.mk.fx.qa.load.generator.events;

import java.time.Instant;

/**
 * Detail record for one successful response, emitted only in detailed mode.
 *
 * @param workerId zero-based worker index
 * @param statusCode response status code
 * @param timestamp time the response was recorded
 */
public record RequestEvent(int workerId, int statusCode, Instant timestamp) {}
