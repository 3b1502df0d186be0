package com.pulsewatch.agent.forward;

public class ForwardingException extends RuntimeException {

    public ForwardingException(String message) {
        super(message);
    }

    public ForwardingException(String message, Throwable cause) {
        super(message, cause);
    }
}
