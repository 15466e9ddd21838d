package org.spacompose.module;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ModulePathTest {

    @Test
    void parse_splitsOnFirstDot() {
        ModulePath path = ModulePath.parse("a.b.c");

        assertThat(path.head()).isEqualTo("a");
        assertThat(path.remainder()).isEqualTo("b.c");
        assertThat(path.isLeaf()).isFalse();
    }

    @Test
    void parse_singleSegmentIsLeaf() {
        ModulePath path = ModulePath.parse("vision");

        assertThat(path.head()).isEqualTo("vision");
        assertThat(path.isLeaf()).isTrue();
    }

    @Test
    void parseLegacy_lastUnderscoreWins() {
        assertThat(ModulePath.parseLegacy("my_module_x"))
                .contains(new ModulePath("my_module", "x"));
        assertThat(ModulePath.parseLegacy("plain")).isEmpty();
        assertThat(ModulePath.parseLegacy("trailing_")).contains(new ModulePath("trailing", ""));
    }
}
