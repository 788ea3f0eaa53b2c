package com.familyportfolio.domain.exception;

/**
 * Business-rule failure raised by the domain. Argument errors (a missing required input) are
 * reported with the standard {@link NullPointerException}/{@link IllegalArgumentException} instead.
 */
public class ServiceException extends RuntimeException {

    private final Error error;

    public ServiceException(Error error) {
        super(error.code());
        this.error = error;
    }

    public ServiceException(Error error, String message) {
        super(message);
        this.error = error;
    }

    public ServiceException(Error error, Throwable cause) {
        super(cause.getMessage(), cause);
        this.error = error;
    }

    public ServiceException(Error error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public Error getError() {
        return error;
    }

    public String getErrorCode() {
        return error.code();
    }
}
