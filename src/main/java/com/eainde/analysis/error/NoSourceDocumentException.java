package com.eainde.analysis.error;

/**
 * Request-level rejection: the subject is known but has no usable statement text.
 */
public class NoSourceDocumentException extends RuntimeException {

    public NoSourceDocumentException(String subject) {
        super("No source document available for subject: " + subject);
    }
}
