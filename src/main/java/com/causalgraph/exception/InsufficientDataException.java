package com.causalgraph.exception;

/**
 * Raised inside validation and pattern mining when a candidate has too few data points.
 * Always caught by the analytics run, which drops the candidate and continues.
 */
public class InsufficientDataException extends BaseException {

    public InsufficientDataException(String subject, int required, int actual) {
        super(
                ErrorCode.INSUFFICIENT_DATA,
                String.format("%s has %d data points, at least %d required", subject, actual, required));
    }
}
