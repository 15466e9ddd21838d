package org.spacompose.vocab;

import java.util.Random;

/**
 * An opaque handle for a symbolic vector space of fixed dimensionality.
 * <p>
 * Handles are compared by identity: two vocabularies with the same dimensionality are still
 * different spaces unless they are the same instance. Ports that must share a space therefore
 * share the handle obtained from a common {@link VocabularyMap}.
 */
public final class Vocabulary {

    private final int dimensions;
    private final Random rng;

    /**
     * Creates a vocabulary without a dedicated random source.
     *
     * @param dimensions The dimensionality of the space (must be positive).
     * @throws InvalidDimensionException if {@code dimensions} is not positive.
     */
    public Vocabulary(int dimensions) {
        this(dimensions, null);
    }

    /**
     * Creates a vocabulary that draws its vectors from the given random source.
     *
     * @param dimensions The dimensionality of the space (must be positive).
     * @param rng The random source, or {@code null} for an unseeded one.
     * @throws InvalidDimensionException if {@code dimensions} is not positive.
     */
    public Vocabulary(int dimensions, Random rng) {
        if (dimensions < 1) {
            throw new InvalidDimensionException(dimensions);
        }
        this.dimensions = dimensions;
        this.rng = rng;
    }

    public int dimensions() {
        return dimensions;
    }

    /**
     * @return The random source the vocabulary was created with, or {@code null}.
     */
    public Random rng() {
        return rng;
    }

    @Override
    public String toString() {
        return "Vocabulary[dimensions=" + dimensions + "]";
    }
}
