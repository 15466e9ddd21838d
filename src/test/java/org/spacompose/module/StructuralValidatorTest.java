package org.spacompose.module;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.spacompose.network.Network;
import org.spacompose.network.NetworkContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the scope-close check performed by {@link StructuralValidator}.
 */
@Tag("unit")
class StructuralValidatorTest {

    @Test
    void cleanClose_withUnregisteredNestedModule_throws() {
        Module parent = new Module("parent");

        assertThatThrownBy(() -> parent.build(() -> new Module("orphan")))
                .isInstanceOf(StructuralIntegrityException.class)
                .hasMessageContaining("orphan")
                .satisfies(e -> assertThat(((StructuralIntegrityException) e).getOffender().getLabel())
                        .isEqualTo("orphan"));
        assertThat(NetworkContext.depth()).isZero();
    }

    @Test
    void exceptionInScope_propagatesUnchangedAndSkipsCheck() {
        Module parent = new Module("parent");
        IllegalArgumentException failure = new IllegalArgumentException("boom");

        assertThatThrownBy(() -> parent.build(() -> {
            new Module("orphan");
            throw failure;
        })).isSameAs(failure);
        assertThat(failure.getSuppressed()).isEmpty();
    }

    @Test
    void cleanClose_withAllNestedModulesRegistered_passes() {
        Module parent = new Module("parent");

        assertThatCode(() -> parent.build(() -> {
            parent.add("a", new Module(null));
            parent.assign("b", new Module(null));
        })).doesNotThrowAnyException();
        assertThat(parent.getNetworks()).hasSize(2);
    }

    @Test
    void plainNestedNetworks_areIgnored() {
        Module parent = new Module("parent");

        assertThatCode(() -> parent.build(() -> new Network("helper"))).doesNotThrowAnyException();
    }

    @Test
    void registeredButNotNestedModules_passValidation() {
        Module parent = new Module("parent");
        Module outside = new Module("outside");

        assertThatCode(() -> parent.build(() -> parent.add("outside", outside))).doesNotThrowAnyException();
    }

    @Test
    void moduleNotAddedToContainer_isNotChecked() {
        Module parent = new Module("parent");

        assertThatCode(() -> parent.build(() -> new Module("detached", null, false, null)))
                .doesNotThrowAnyException();
    }

    @Test
    void innerScopeFailure_reportsInnermostOffender() {
        Module outer = new Module("outer");

        assertThatThrownBy(() -> outer.build(() -> {
            Module inner = outer.add("inner", new Module(null));
            inner.build(() -> new Module("lost"));
        })).isInstanceOf(StructuralIntegrityException.class)
                .hasMessageContaining("lost")
                .hasMessageContaining("inner");
    }
}
