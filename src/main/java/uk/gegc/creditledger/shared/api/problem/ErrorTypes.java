package uk.gegc.creditledger.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://credit-ledger.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI RESOURCE_NOT_FOUND = URI.create(BASE_URL + "/resource-not-found");
    public static final URI WORKSPACE_NOT_FOUND = URI.create(BASE_URL + "/workspace-not-found");
    public static final URI PLAN_NOT_FOUND = URI.create(BASE_URL + "/plan-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI CONSTRAINT_VIOLATION = URI.create(BASE_URL + "/constraint-violation");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Billing Errors ====================
    public static final URI INSUFFICIENT_CREDITS = URI.create(BASE_URL + "/insufficient-credits");
    public static final URI UNKNOWN_MODEL = URI.create(BASE_URL + "/unknown-model");
    public static final URI IDEMPOTENCY_CONFLICT = URI.create(BASE_URL + "/idempotency-conflict");
    public static final URI LEDGER_WRITE_CONFLICT = URI.create(BASE_URL + "/ledger-write-conflict");
    public static final URI LEDGER_INTEGRITY = URI.create(BASE_URL + "/ledger-integrity");
    public static final URI INVOICE_COLLABORATOR_UNAVAILABLE = URI.create(BASE_URL + "/invoice-collaborator-unavailable");

    // ==================== System Errors ====================
    public static final URI DATA_INTEGRITY_VIOLATION = URI.create(BASE_URL + "/data-integrity-violation");
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
