package org.shipplan.transport.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Base solver failure with a deterministic reason code.
 *
 * <p>Messages are prefixed with the reason code so log lines stay grep-able.</p>
 */
@Getter
public abstract class TransportationException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded solver failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    protected TransportationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded solver failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    protected TransportationException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
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
