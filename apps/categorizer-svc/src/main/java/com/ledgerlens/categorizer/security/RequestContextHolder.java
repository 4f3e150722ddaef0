package com.ledgerlens.categorizer.security;

import java.util.Optional;
import java.util.UUID;

/**
 * Per-request trace id and caller id, bound to the serving thread.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void startRequest(String traceId) {
        CONTEXT.set(new RequestContext(null, traceId));
    }

    public static void setUserId(UUID userId) {
        RequestContext current = CONTEXT.get();
        CONTEXT.set(current == null ? new RequestContext(userId, null) : current.withUserId(userId));
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<String> currentTraceId() {
        return get().map(RequestContext::traceId);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    public record RequestContext(UUID userId, String traceId) {

        RequestContext withUserId(UUID newUserId) {
            return new RequestContext(newUserId, traceId);
        }
    }
}
