package com.demo.underwriting.exception;

/** Static weights or thresholds are malformed. Raised while the context starts. */
public class ConfigurationDefectException extends UnderwritingException {

    public ConfigurationDefectException(String message) {
        super(message);
    }
}
