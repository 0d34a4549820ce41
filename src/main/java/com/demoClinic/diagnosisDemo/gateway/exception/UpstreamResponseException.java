package com.demoClinic.diagnosisDemo.gateway.exception;

/**
 * Exception thrown when an analysis envelope from the edge functions reports a
 * failure or carries no record.
 */
public class UpstreamResponseException extends RuntimeException {

    public UpstreamResponseException(String message) {
        super(message);
    }
}
