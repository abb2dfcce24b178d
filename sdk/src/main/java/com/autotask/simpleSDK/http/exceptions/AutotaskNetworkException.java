package com.autotask.simpleSDK.http.exceptions;

public class AutotaskNetworkException extends AutotaskException {
    private final boolean timeout;

    public AutotaskNetworkException(String message, Throwable cause) {
        this(message, false, cause);
    }

    public AutotaskNetworkException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
