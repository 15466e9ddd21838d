package org.spacompose.module;

import org.spacompose.vocab.Vocabulary;
import org.spacompose.vocab.VocabularyMap;

import java.util.Optional;

/**
 * The vocabulary side of a port: either a dimensionality still waiting for a shared vocabulary,
 * or the vocabulary itself.
 */
public sealed interface VocabBinding permits VocabBinding.Raw, VocabBinding.Resolved {

    /**
     * Binds a raw dimensionality to the vocabulary the map holds for it.
     * A resolved binding is returned unchanged.
     *
     * @param vocabs The map to take the vocabulary from.
     * @return The resolved binding.
     */
    Resolved resolve(VocabularyMap vocabs);

    /**
     * @return The vocabulary, or empty while the binding is raw.
     */
    Optional<Vocabulary> vocabulary();

    /**
     * @return The dimensionality of the binding.
     */
    int dimensions();

    static VocabBinding of(int dimensions) {
        return new Raw(dimensions);
    }

    static VocabBinding of(Vocabulary vocabulary) {
        return new Resolved(vocabulary);
    }

    /**
     * A declared dimensionality.
     *
     * @param dimensions The requested dimensionality.
     */
    record Raw(int dimensions) implements VocabBinding {

        @Override
        public Resolved resolve(VocabularyMap vocabs) {
            return new Resolved(vocabs.getOrCreate(dimensions));
        }

        @Override
        public Optional<Vocabulary> vocabulary() {
            return Optional.empty();
        }
    }

    /**
     * A bound vocabulary.
     *
     * @param handle The shared vocabulary handle.
     */
    record Resolved(Vocabulary handle) implements VocabBinding {

        @Override
        public Resolved resolve(VocabularyMap vocabs) {
            return this;
        }

        @Override
        public Optional<Vocabulary> vocabulary() {
            return Optional.of(handle);
        }

        @Override
        public int dimensions() {
            return handle.dimensions();
        }
    }
}
