package org.spacompose.module;

import org.spacompose.vocab.VocabularyMap;

/**
 * A named slot of a module: the object to connect to and the vocabulary it carries.
 *
 * @param target  The object connections attach to (usually a {@link org.spacompose.network.Node}).
 * @param binding The vocabulary binding.
 */
public record Port(Object target, VocabBinding binding) {

    /**
     * @param vocabs The map raw bindings are resolved against.
     * @return This port if already resolved, otherwise a copy with a resolved binding.
     */
    Port resolve(VocabularyMap vocabs) {
        if (binding instanceof VocabBinding.Resolved) {
            return this;
        }
        return new Port(target, binding.resolve(vocabs));
    }
}
