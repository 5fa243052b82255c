package com.mk.fx.qa.load.generator.rest;

import java.io.EOFException;
import java.net.ConnectException;
import java.net.ProtocolException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.UnresolvedAddressException;
import java.util.ArrayList;
import java.util.List;
import javax.net.ssl.SSLException;

/** Categories of transport-level failures, derived from the exception and its causes. */
public enum FailureType {
    CONNECTION_REFUSED,
    TIMEOUT,
    UNKNOWN_HOST,
    SSL_ERROR,
    PROTOCOL_ERROR,
    INTERRUPTED,
    OTHER;

    /**
     * Classifies a failure. The whole cause chain is inspected because {@link java.net.http.HttpClient}
     * wraps resolution errors in a {@link ConnectException}; more specific causes win.
     */
    public static FailureType classify(Throwable t) {
        if (t == null) {
            return OTHER;
        }
        var chain = causeChain(t);
        if (any(chain, UnknownHostException.class, UnresolvedAddressException.class)) {
            return UNKNOWN_HOST;
        }
        if (any(chain, HttpTimeoutException.class, SocketTimeoutException.class)) {
            return TIMEOUT;
        }
        if (any(chain, SSLException.class)) {
            return SSL_ERROR;
        }
        if (any(chain, InterruptedException.class)) {
            return INTERRUPTED;
        }
        if (any(chain, ConnectException.class, ClosedChannelException.class)) {
            return CONNECTION_REFUSED;
        }
        if (any(chain, ProtocolException.class, EOFException.class, IllegalArgumentException.class)) {
            return PROTOCOL_ERROR;
        }
        return OTHER;
    }

    static Throwable rootCause(Throwable t) {
        if (t == null) {
            return null;
        }
        var chain = causeChain(t);
        return chain.get(chain.size() - 1);
    }

    private static List<Throwable> causeChain(Throwable t) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = t;
        while (current != null && !chain.contains(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }

    @SafeVarargs
    private static boolean any(List<Throwable> chain, Class<? extends Throwable>... types) {
        for (Throwable candidate : chain) {
            for (Class<? extends Throwable> type : types) {
                if (type.isInstance(candidate)) {
                    return true;
                }
            }
        }
        return false;
    }
}
