package com.selfmx.error;

/**
 * Caller facing failure carrying an {@link ApiError} code.
 *
 * <p>Thrown by services and handlers; converted to a JSON error body by the API router.
 */
public class ApiException extends RuntimeException {

    private final ApiError error;

    /**
     * Constructs a new ApiException with the default message of the error.
     *
     * @param error Error code.
     */
    public ApiException(ApiError error) {
        this(error, error.getMessage());
    }

    /**
     * Constructs a new ApiException.
     *
     * @param error   Error code.
     * @param message Message returned to the caller.
     */
    public ApiException(ApiError error, String message) {
        super(message);
        this.error = error;
    }

    public ApiError getError() {
        return error;
    }

    public int getStatus() {
        return error.getStatus();
    }
}
