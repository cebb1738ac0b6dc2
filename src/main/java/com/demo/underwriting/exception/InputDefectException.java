package com.demo.underwriting.exception;

/**
 * A raw record breaks a precondition the calling layer should already have
 * validated. Fatal to the invocation.
 */
public class InputDefectException extends UnderwritingException {

    private final String field;

    public InputDefectException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
