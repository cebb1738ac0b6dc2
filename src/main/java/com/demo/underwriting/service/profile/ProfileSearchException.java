package com.demo.underwriting.service.profile;

/** A single profile lookup failed. Never escapes the evidence collector. */
public class ProfileSearchException extends Exception {

    public ProfileSearchException(String message) {
        super(message);
    }

    public ProfileSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
