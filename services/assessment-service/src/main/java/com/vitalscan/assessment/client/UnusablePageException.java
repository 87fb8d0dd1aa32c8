package com.vitalscan.assessment.client;

/**
 * A page that arrived but could not be turned into at least one patient record.
 */
public class UnusablePageException extends RuntimeException {

    public UnusablePageException(String message) {
        super(message);
    }

    public UnusablePageException(String message, Throwable cause) {
        super(message, cause);
    }
}
