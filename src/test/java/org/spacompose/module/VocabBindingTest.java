package org.spacompose.module;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.spacompose.vocab.Vocabulary;
import org.spacompose.vocab.VocabularyMap;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class VocabBindingTest {

    @Test
    void rawBinding_resolvesAgainstMap() {
        VocabularyMap vocabs = new VocabularyMap();
        VocabBinding raw = VocabBinding.of(16);

        VocabBinding.Resolved resolved = raw.resolve(vocabs);

        assertThat(raw.vocabulary()).isEmpty();
        assertThat(resolved.vocabulary()).containsSame(vocabs.getOrCreate(16));
        assertThat(resolved.dimensions()).isEqualTo(16);
    }

    @Test
    void resolvedBinding_isNotReResolved() {
        Vocabulary own = new Vocabulary(16);
        VocabBinding.Resolved resolved = new VocabBinding.Resolved(own);
        VocabularyMap other = new VocabularyMap();

        assertThat(resolved.resolve(other)).isSameAs(resolved);
        assertThat(other.size()).isZero();
    }
}
