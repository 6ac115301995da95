package com.causalgraph.exception;

public class InvalidWindowException extends BaseException {

    public InvalidWindowException(String message) {
        super(ErrorCode.INVALID_WINDOW, message);
    }
}
