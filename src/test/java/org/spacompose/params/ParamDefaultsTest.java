package org.spacompose.params;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ParamDefaultsTest {

    private static final IntParam NEURONS = new IntParam("neurons", 100, 1);

    static class Base {
    }

    static class Derived extends Base {
    }

    @Test
    void lookup_fallsBackToBuiltInDefault() {
        assertThat(new ParamDefaults().lookup(Derived.class, NEURONS)).isEqualTo(100);
    }

    @Test
    void lookup_prefersBaseValuesOverBuiltIn() {
        ParamDefaults defaults = new ParamDefaults(Map.of("neurons", 50));

        assertThat(defaults.lookup(Derived.class, NEURONS)).isEqualTo(50);
    }

    @Test
    void lookup_mostSpecificTypeWins() {
        ParamDefaults defaults = new ParamDefaults(Map.of("neurons", 50));
        defaults.configure(Base.class, NEURONS, 20);

        assertThat(defaults.lookup(Derived.class, NEURONS)).isEqualTo(20);

        defaults.configure(Derived.class, NEURONS, 30);

        assertThat(defaults.lookup(Derived.class, NEURONS)).isEqualTo(30);
        assertThat(defaults.lookup(Base.class, NEURONS)).isEqualTo(20);
        assertThat(defaults.lookup(Object.class, NEURONS)).isEqualTo(50);
    }
}
