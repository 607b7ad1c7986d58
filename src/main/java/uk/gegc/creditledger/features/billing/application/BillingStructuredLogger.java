package uk.gegc.creditledger.features.billing.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging for ledger writes. Fields go to the MDC for the duration of one log call.
 */
public final class BillingStructuredLogger {

    private BillingStructuredLogger() {
    }

    public static void logLedgerWrite(Logger logger, String level, String message,
            UUID workspaceId, String txType, String source, long amount,
            String idempotencyKey, long balanceAfter, long reservedAfter,
            String refId, Object... additionalArgs) {

        MDC.put("billing.workspaceId", workspaceId != null ? workspaceId.toString() : null);
        MDC.put("billing.txType", txType);
        MDC.put("billing.source", source);
        MDC.put("billing.amount", String.valueOf(amount));
        MDC.put("billing.idempotencyKey", idempotencyKey);
        MDC.put("billing.balanceAfter", String.valueOf(balanceAfter));
        MDC.put("billing.reservedAfter", String.valueOf(reservedAfter));
        MDC.put("billing.refId", refId);

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearBillingMDC();
        }
    }

    public static void logReservationOperation(Logger logger, String level, String message,
            UUID workspaceId, String operation, long amount, UUID reservationId,
            Object... additionalArgs) {

        MDC.put("billing.workspaceId", workspaceId != null ? workspaceId.toString() : null);
        MDC.put("billing.operation", operation);
        MDC.put("billing.amount", String.valueOf(amount));
        MDC.put("billing.reservationId", reservationId != null ? reservationId.toString() : null);

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearBillingMDC();
        }
    }

    public static void clearBillingMDC() {
        MDC.remove("billing.workspaceId");
        MDC.remove("billing.txType");
        MDC.remove("billing.source");
        MDC.remove("billing.amount");
        MDC.remove("billing.idempotencyKey");
        MDC.remove("billing.balanceAfter");
        MDC.remove("billing.reservedAfter");
        MDC.remove("billing.refId");
        MDC.remove("billing.operation");
        MDC.remove("billing.reservationId");
    }

    private static void log(Logger logger, String level, String message, Object... args) {
        switch (level.toLowerCase()) {
            case "warn" -> logger.warn(message, args);
            case "error" -> logger.error(message, args);
            case "debug" -> logger.debug(message, args);
            default -> logger.info(message, args);
        }
    }
}
