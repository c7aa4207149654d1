package com.eainde.analysis.source;

import com.eainde.analysis.error.NoSourceDocumentException;
import com.eainde.analysis.error.UnknownSubjectException;

/**
 * Boundary to whatever turns a subject's published statements into text.
 */
public interface SourceDocumentProvider {

    /**
     * @param subject normalized (upper-case) subject
     * @throws UnknownSubjectException    when the subject is not known at all
     * @throws NoSourceDocumentException when the subject is known but has no usable text
     */
    SourceDocument load(String subject);
}
