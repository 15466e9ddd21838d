package org.spacompose.vocab;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Maps dimensionalities to vocabularies so that every port declaring the same dimensionality
 * ends up in the same vector space.
 * <p>
 * A map may be shared by many modules (an ancestor's map reused by its descendants, or a map
 * passed in at root construction). It is not thread-safe; modules are built by a single thread.
 */
public class VocabularyMap implements Iterable<Vocabulary> {

    private static final Logger LOG = LoggerFactory.getLogger(VocabularyMap.class);

    private final Map<Integer, Vocabulary> vocabs = new LinkedHashMap<>();
    private final Random rng;

    /**
     * Creates an empty map whose vocabularies use unseeded random sources.
     */
    public VocabularyMap() {
        this(null);
    }

    /**
     * Creates an empty map.
     *
     * @param rng The random source handed to every vocabulary this map creates, or {@code null}.
     */
    public VocabularyMap(Random rng) {
        this.rng = rng;
    }

    /**
     * Creates a map pre-populated with the given vocabularies.
     *
     * @param vocabularies Vocabularies to insert, in order.
     * @param rng The random source for vocabularies created later, or {@code null}.
     */
    public VocabularyMap(Collection<Vocabulary> vocabularies, Random rng) {
        this(rng);
        for (Vocabulary vocabulary : vocabularies) {
            add(vocabulary);
        }
    }

    /**
     * Inserts a vocabulary for its dimensionality. Later {@link #getOrCreate(int)} calls for that
     * dimensionality return it. If a vocabulary of the same dimensionality is already present the
     * new one replaces it.
     *
     * @param vocabulary The vocabulary to insert.
     */
    public void add(Vocabulary vocabulary) {
        Vocabulary previous = vocabs.put(vocabulary.dimensions(), vocabulary);
        if (previous != null && previous != vocabulary) {
            LOG.warn("Duplicate vocabularies with dimension {}. Using the last entry.", vocabulary.dimensions());
        }
    }

    /**
     * Returns the vocabulary for a dimensionality, creating and caching it on first request.
     *
     * @param dimensions The requested dimensionality.
     * @return The cached vocabulary; the same instance for every call with the same argument.
     * @throws InvalidDimensionException if {@code dimensions} is not positive.
     */
    public Vocabulary getOrCreate(int dimensions) {
        if (dimensions < 1) {
            throw new InvalidDimensionException(dimensions);
        }
        return vocabs.computeIfAbsent(dimensions, d -> {
            LOG.debug("Creating vocabulary of dimension {}", d);
            return new Vocabulary(d, rng);
        });
    }

    /**
     * Looks up a vocabulary without creating one.
     *
     * @param dimensions The dimensionality.
     * @return The vocabulary, or empty if none has been added or created for it.
     */
    public Optional<Vocabulary> get(int dimensions) {
        return Optional.ofNullable(vocabs.get(dimensions));
    }

    public boolean contains(int dimensions) {
        return vocabs.containsKey(dimensions);
    }

    /**
     * Removes the vocabulary registered for a dimensionality.
     *
     * @param dimensions The dimensionality.
     * @return The removed vocabulary, or empty if there was none.
     */
    public Optional<Vocabulary> remove(int dimensions) {
        return Optional.ofNullable(vocabs.remove(dimensions));
    }

    /**
     * Removes a vocabulary only if it is the one currently registered for its dimensionality.
     *
     * @param vocabulary The vocabulary to discard.
     */
    public void discard(Vocabulary vocabulary) {
        vocabs.remove(vocabulary.dimensions(), vocabulary);
    }

    public int size() {
        return vocabs.size();
    }

    /**
     * @return The random source handed to created vocabularies, or {@code null}.
     */
    public Random rng() {
        return rng;
    }

    @Override
    public Iterator<Vocabulary> iterator() {
        return Collections.unmodifiableCollection(vocabs.values()).iterator();
    }

    @Override
    public String toString() {
        return "VocabularyMap" + vocabs.keySet();
    }
}
