package com.microblog.infrastructure.context;

import com.microblog.domain.model.UserId;
import org.slf4j.MDC;

/**
 * Per-request caller identity, mirrored into the logging MDC.
 */
public final class RequestContext {

    private static final String USER_ID_KEY = "userId";
    private static final String REQUEST_ID_KEY = "requestId";

    private static final ThreadLocal<UserId> currentUserId = new ThreadLocal<>();
    private static final ThreadLocal<String> currentRequestId = new ThreadLocal<>();

    private RequestContext() {}

    public static void set(UserId userId, String requestId) {
        currentUserId.set(userId);
        MDC.put(USER_ID_KEY, userId.toString());
        setRequestId(requestId);
    }

    /**
     * Binds only the request id, for paths that run without a caller identity.
     */
    public static void setRequestId(String requestId) {
        currentRequestId.set(requestId);
        MDC.put(REQUEST_ID_KEY, requestId);
    }

    public static UserId getUserId() {
        return currentUserId.get();
    }

    public static String getRequestId() {
        return currentRequestId.get();
    }

    public static void clear() {
        currentUserId.remove();
        currentRequestId.remove();
        MDC.remove(USER_ID_KEY);
        MDC.remove(REQUEST_ID_KEY);
    }
}
