package com.autotask.simpleSDK.http.exceptions;

public class AutotaskException extends Exception {
    public AutotaskException(String message) {
        super(message);
    }

    public AutotaskException(String message, Throwable cause) {
        super(message, cause);
    }

    public AutotaskException(Throwable cause) {
        super(cause);
    }
}
