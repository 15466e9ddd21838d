package org.spacompose.vocab;

/**
 * Computes the similarity of recorded vectors to the entries of a vocabulary.
 */
@FunctionalInterface
public interface ISimilarityFunction {

    /**
     * @param data  The recorded rows.
     * @param vocab The vocabulary to compare against.
     * @return One row of similarities per input row.
     */
    double[][] similarity(double[][] data, Vocabulary vocab);
}
