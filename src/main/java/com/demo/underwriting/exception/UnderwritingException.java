package com.demo.underwriting.exception;

public class UnderwritingException extends RuntimeException {

    public UnderwritingException(String message) {
        super(message);
    }
}
