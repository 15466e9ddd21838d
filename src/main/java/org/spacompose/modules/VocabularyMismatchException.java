package org.spacompose.modules;

import org.spacompose.SpaModuleException;

/**
 * Thrown when two ports are connected whose vocabularies are not the same space.
 */
public class VocabularyMismatchException extends SpaModuleException {

    /**
     * @param source The output path.
     * @param target The input path.
     * @param detail What differs.
     */
    public VocabularyMismatchException(String source, String target, String detail) {
        super("Cannot connect '" + source + "' to '" + target + "': " + detail + ".");
    }
}
