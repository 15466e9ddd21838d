package org.spacompose.vocab;

import org.spacompose.SpaModuleException;

/**
 * Thrown when a vocabulary is requested for a dimensionality that is not a positive integer.
 */
public class InvalidDimensionException extends SpaModuleException {

    private final int dimensions;

    /**
     * @param dimensions The rejected dimensionality.
     */
    public InvalidDimensionException(int dimensions) {
        super("Vocabulary dimensions must be a positive integer, got " + dimensions + ".");
        this.dimensions = dimensions;
    }

    public int getDimensions() {
        return dimensions;
    }
}
