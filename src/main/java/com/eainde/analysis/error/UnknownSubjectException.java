package com.eainde.analysis.error;

/**
 * Request-level rejection: the subject has no entry in the source directory. Never enters a ledger.
 */
public class UnknownSubjectException extends RuntimeException {

    public UnknownSubjectException(String subject) {
        super("Unknown subject: " + subject);
    }
}
