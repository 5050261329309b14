package com.selfmx.error;

/**
 * Stable error codes returned to API callers.
 *
 * <p>Each code maps to one HTTP status and a default message.
 */
public enum ApiError {
    INVALID_REQUEST("invalid_request", 400, "Invalid request body"),
    INVALID_FROM("invalid_from", 400, "Invalid From address format"),
    INVALID_SENDER_PREFIX("invalid_sender_prefix", 400, "Sender prefix may only contain letters, digits, dots, underscores and hyphens"),
    INVALID_RECIPIENT_EMAIL("invalid_recipient_email", 400, "Invalid recipient email address"),
    UNAUTHORIZED("unauthorized", 401, "Invalid or missing API key"),
    FORBIDDEN("forbidden", 403, "Not authorized for this resource"),
    NOT_FOUND("not_found", 404, "Resource not found"),
    METHOD_NOT_ALLOWED("method_not_allowed", 405, "Method not allowed"),
    DOMAIN_EXISTS("domain_exists", 409, "Domain already exists"),
    DOMAIN_IN_USE("domain_in_use", 409, "Domain is referenced by active API keys"),
    DOMAIN_NOT_VERIFIED("domain_not_verified", 409, "Domain is not verified for sending"),
    RATE_LIMITED("rate_limited", 429, "Too many requests"),
    INTERNAL_ERROR("internal_error", 500, "An unexpected error occurred");

    private final String code;
    private final int status;
    private final String message;

    ApiError(String code, int status, String message) {
        this.code = code;
        this.status = status;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public int getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
