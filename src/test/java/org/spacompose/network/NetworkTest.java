package org.spacompose.network;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Network} scopes and nesting.
 */
@Tag("unit")
class NetworkTest {

    @Test
    void networksCreatedInScope_areNested() {
        Network outer = new Network("outer");
        Network[] inner = new Network[1];

        outer.build(() -> {
            inner[0] = new Network("inner");
            inner[0].build(() -> new Network("deep"));
        });

        assertThat(outer.getNetworks()).containsExactly(inner[0]);
        assertThat(inner[0].getNetworks()).extracting(Network::getLabel).containsExactly("deep");
        assertThat(NetworkContext.current()).isEmpty();
    }

    @Test
    void nodesCreatedInScope_joinInnermostNetwork() {
        Network net = new Network("net");
        Node outside = new Node("outside", 2);

        net.build(() -> new Node("inside", 4));

        assertThat(net.getNodes()).extracting(Node::getLabel).containsExactly("inside");
        assertThat(outside.getDimensions()).isEqualTo(2);
    }

    @Test
    void build_passesInFlightExceptionToOnExit() {
        List<Throwable> seen = new ArrayList<>();
        Network net = new Network("net") {
            @Override
            protected void onExit(Throwable inFlight) {
                seen.add(inFlight);
            }
        };
        IllegalStateException failure = new IllegalStateException("fail");

        net.build(() -> { });
        assertThatThrownBy(() -> net.build(() -> {
            throw failure;
        })).isSameAs(failure);

        assertThat(seen).containsExactly(null, failure);
    }

    @Test
    void exit_ofNonInnermostScope_throwsAndClosesNestedScopes() {
        Network outer = new Network("outer");
        Network inner = new Network("inner", null, false);
        outer.enter();
        inner.enter();

        assertThatThrownBy(() -> outer.exit(null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("innermost");
        assertThat(NetworkContext.depth()).isZero();
    }

    @Test
    void exit_ofScopeThatIsNotOpen_throwsWithoutTouchingOpenScopes() {
        Network open = new Network("open");
        Network closed = new Network("closed", null, false);
        open.enter();
        try {
            assertThatThrownBy(() -> closed.exit(null))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("not open");
            assertThat(NetworkContext.current()).containsSame(open);
        } finally {
            open.exit(null);
        }
    }

    @Test
    void build_failureWithUnclosedInnerScope_rethrowsOriginalException() {
        Network parent = new Network("parent");
        Network stray = new Network("stray", null, false);
        IllegalArgumentException failure = new IllegalArgumentException("boom");

        assertThatThrownBy(() -> parent.build(() -> {
            stray.enter();
            throw failure;
        })).isSameAs(failure);

        assertThat(failure.getSuppressed()).hasSize(1);
        assertThat(failure.getSuppressed()[0]).isInstanceOf(IllegalStateException.class);
        assertThat(NetworkContext.depth()).isZero();
        assertThat(new Network("later").getLabel()).isEqualTo("later");
        assertThat(stray.getNetworks()).isEmpty();
    }

    @Test
    void addToContainerWithoutOpenScope_throws() {
        assertThatThrownBy(() -> new Network("lonely", null, true))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void connect_recordsConnection() {
        Network net = new Network("net");

        Connection connection = net.connect("a", "b");

        assertThat(net.getConnections()).containsExactly(new Connection("a", "b"));
        assertThat(connection.pre()).isEqualTo("a");
    }

    @Test
    void innermost_findsClosestNetworkOfType() {
        Network plain = new Network("plain");
        Network[] found = new Network[1];

        plain.build(() -> found[0] = NetworkContext.innermost(Network.class).orElseThrow());

        assertThat(found[0]).isSameAs(plain);
    }
}
