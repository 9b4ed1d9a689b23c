package com.cortexplatform.core.mcp;

/**
 * Failure of a dispatched tool call or resource read, classified for the caller.
 */
public class DispatchException extends RuntimeException {

    public enum Kind {
        /** Unknown service, tool or resource. */
        NOT_FOUND,
        /** Arguments or template parameters rejected. */
        INVALID,
        /** Service unreachable, disconnected, or still failing after retries. */
        UNAVAILABLE,
        /** The service failed the request or missed the deadline. */
        REMOTE
    }

    private final Kind kind;
    private final String service;
    private final String detail;

    public DispatchException(Kind kind, String service, String detail) {
        this(kind, service, detail, null);
    }

    public DispatchException(Kind kind, String service, String detail, Throwable cause) {
        super(kind + " [" + service + "]: " + detail, cause);
        this.kind = kind;
        this.service = service;
        this.detail = detail;
    }

    public Kind getKind() {
        return kind;
    }

    public String getService() {
        return service;
    }

    public String getDetail() {
        return detail;
    }
}
