package org.itinera.routing.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Route failure with a stable error kind and reason code.
 *
 * <p>The message is prefixed with the reason code: {@code "[NO_PATH] no route from ..."}.</p>
 */
@Getter
public final class RouteException extends RuntimeException {
    private final RouteErrorKind kind;
    private final String reasonCode;
    private final String detail;

    /**
     * Creates a reason-coded route failure.
     *
     * @param kind error classification.
     * @param reasonCode stable reason code.
     * @param message descriptive error message.
     */
    public RouteException(RouteErrorKind kind, String reasonCode, String message) {
        this(kind, reasonCode, message, null, null);
    }

    /**
     * Creates a reason-coded route failure with a cause.
     */
    public RouteException(RouteErrorKind kind, String reasonCode, String message, Throwable cause) {
        this(kind, reasonCode, message, null, cause);
    }

    /**
     * Creates a reason-coded route failure carrying a user-facing detail text.
     *
     * @param detail optional free text, for example the offending country code.
     */
    public RouteException(RouteErrorKind kind, String reasonCode, String message, String detail, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reasonCode = requireReasonCode(reasonCode);
        this.detail = detail;
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
