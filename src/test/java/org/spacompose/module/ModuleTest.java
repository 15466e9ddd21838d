package org.spacompose.module;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.spacompose.config.SpaSettings;
import org.spacompose.network.IProbeData;
import org.spacompose.vocab.ISimilarityFunction;
import org.spacompose.vocab.Vocabulary;
import org.spacompose.vocab.VocabularyMap;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link Module} construction, shared state and similarity lookup.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ModuleTest {

    private static final Object PROBE = new Object();

    @Mock
    private IProbeData data;

    @Mock
    private ISimilarityFunction similarity;

    @Test
    void moduleInsideScope_sharesEnclosingState() {
        Module root = new Module("root");
        Module[] inner = new Module[1];

        root.build(() -> inner[0] = root.add("inner", new Module(null)));

        assertThat(inner[0].getVocabs()).isSameAs(root.getVocabs());
        assertThat(inner[0].getDiagnostics()).isSameAs(root.getDiagnostics());
        assertThat(inner[0].getParamDefaults()).isSameAs(root.getParamDefaults());
    }

    @Test
    void standaloneModules_haveTheirOwnMaps() {
        Module a = new Module("a");
        Module b = new Module("b");

        assertThat(a.getVocabs()).isNotSameAs(b.getVocabs());
    }

    @Test
    void explicitVocabularyMap_isUsed() {
        VocabularyMap shared = new VocabularyMap();
        Module root = new Module("root", null, null, shared);

        assertThat(root.getVocabs()).isSameAs(shared);
    }

    @Test
    void seededModules_createReproducibleRandomSources() {
        Module first = new Module("a", 7L, null, null);
        Module second = new Module("b", 7L, null, null);

        assertThat(first.getVocabs().rng().nextLong()).isEqualTo(second.getVocabs().rng().nextLong());
        assertThat(new Module("c").getVocabs().rng()).isNull();
    }

    @Test
    void parameters_defaultFromSettings() {
        Module module = new Module("m", null, false, null, new SpaSettings(true, Map.of("dimPerEnsemble", 8)));

        assertThat(module.getDimPerEnsemble()).isEqualTo(8);
        assertThat(module.getSynapse()).isEqualTo(0.01);
    }

    @Test
    void similarity_withoutVocab_usesVocabularyOfDataWidth() {
        Module module = new Module("m");
        Vocabulary v3 = module.getVocabs().getOrCreate(3);
        double[][] rows = {{1, 0, 0}, {0, 1, 0}};
        double[][] expected = {{0.5}, {0.25}};
        when(data.get(PROBE)).thenReturn(rows);
        when(similarity.similarity(rows, v3)).thenReturn(expected);

        assertThat(module.similarity(data, PROBE, null, similarity)).isSameAs(expected);
    }

    @Test
    void similarity_withoutRecordedRows_usesVocabularyOfProbeWidth() {
        Module module = new Module("m");
        Vocabulary v8 = module.getVocabs().getOrCreate(8);
        double[][] rows = new double[0][];
        double[][] expected = new double[0][];
        when(data.get(PROBE)).thenReturn(rows);
        when(data.dimensions(PROBE)).thenReturn(8);
        when(similarity.similarity(rows, v8)).thenReturn(expected);

        assertThat(module.similarity(data, PROBE, null, similarity)).isSameAs(expected);
    }

    @Test
    void similarity_withExplicitVocab_skipsLookup() {
        Module module = new Module("m");
        Vocabulary explicit = new Vocabulary(2);
        double[][] rows = {{1, 0}};
        when(data.get(PROBE)).thenReturn(rows);
        when(similarity.similarity(rows, explicit)).thenReturn(new double[][]{{1}});

        module.similarity(data, PROBE, explicit, similarity);

        assertThat(module.getVocabs().size()).isZero();
    }

    @Test
    void similarity_unknownWidth_throws() {
        Module module = new Module("m");
        when(data.get(PROBE)).thenReturn(new double[][]{{1, 2, 3, 4}});

        assertThatThrownBy(() -> module.similarity(data, PROBE, null, similarity))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("dimension 4");
        verify(similarity, never()).similarity(any(), any());
    }
}
