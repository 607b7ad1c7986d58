package uk.gegc.creditledger.features.billing.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uk.gegc.creditledger.features.billing.domain.exception.IdempotencyConflictException;
import uk.gegc.creditledger.features.billing.domain.exception.InsufficientCreditsException;
import uk.gegc.creditledger.features.billing.domain.exception.LedgerIntegrityException;
import uk.gegc.creditledger.features.billing.domain.exception.LedgerWriteConflictException;
import uk.gegc.creditledger.features.billing.domain.exception.UnknownModelException;
import uk.gegc.creditledger.features.overage.domain.exception.InvoiceCollaboratorUnavailableException;
import uk.gegc.creditledger.shared.api.problem.ErrorTypes;
import uk.gegc.creditledger.shared.api.problem.ProblemDetailBuilder;

/**
 * Maps ledger exceptions to RFC 7807 Problem Detail responses.
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice
public class BillingErrorHandler {

    @ExceptionHandler(InsufficientCreditsException.class)
    public ResponseEntity<ProblemDetail> handleInsufficientCredits(InsufficientCreditsException ex, HttpServletRequest request) {
        log.warn("Insufficient credits for workspace {}: {}", ex.getWorkspaceId(), ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.INSUFFICIENT_CREDITS,
                "Insufficient Credits",
                ex.getMessage(),
                request
        );
        problem.setProperty("errorCode", "INSUFFICIENT_CREDITS");
        problem.setProperty("required", ex.getRequired());
        problem.setProperty("available", ex.getAvailable());
        problem.setProperty("shortfall", ex.getShortfall());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(UnknownModelException.class)
    public ResponseEntity<ProblemDetail> handleUnknownModel(UnknownModelException ex, HttpServletRequest request) {
        log.warn("Unknown model: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.UNPROCESSABLE_ENTITY,
                ErrorTypes.UNKNOWN_MODEL,
                "Unknown Model",
                ex.getMessage(),
                request
        );
        problem.setProperty("model", ex.getModel());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
    }

    @ExceptionHandler(IdempotencyConflictException.class)
    public ResponseEntity<ProblemDetail> handleIdempotencyConflict(IdempotencyConflictException ex, HttpServletRequest request) {
        log.warn("Idempotency conflict: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.CONFLICT,
                ErrorTypes.IDEMPOTENCY_CONFLICT,
                "Idempotency Conflict",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(LedgerWriteConflictException.class)
    public ResponseEntity<ProblemDetail> handleWriteConflict(LedgerWriteConflictException ex, HttpServletRequest request) {
        log.warn("Ledger write conflict after {} attempts: {}", ex.getAttempts(), ex.getMessage());
        long retryAfterSeconds = 1;
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.SERVICE_UNAVAILABLE,
                ErrorTypes.LEDGER_WRITE_CONFLICT,
                "Ledger Busy",
                "The workspace balance is under heavy contention. Please retry.",
                request
        );
        problem.setProperty("retryAfterSeconds", retryAfterSeconds);
        problem.setProperty("attempts", ex.getAttempts());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header("Retry-After", String.valueOf(retryAfterSeconds))
                .body(problem);
    }

    @ExceptionHandler(LedgerIntegrityException.class)
    public ResponseEntity<ProblemDetail> handleIntegrity(LedgerIntegrityException ex, HttpServletRequest request) {
        log.error("Ledger integrity violation rejected: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.LEDGER_INTEGRITY,
                "Ledger Integrity Violation",
                "The operation was rejected because it would corrupt the credit ledger",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler(InvoiceCollaboratorUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleInvoiceUnavailable(InvoiceCollaboratorUnavailableException ex,
                                                                  HttpServletRequest request) {
        log.warn("Invoice collaborator unavailable: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.SERVICE_UNAVAILABLE,
                ErrorTypes.INVOICE_COLLABORATOR_UNAVAILABLE,
                "Invoicing Unavailable",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
    }
}
