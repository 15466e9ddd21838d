package org.spacompose.network;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * The stack of network construction scopes that are currently open on this thread.
 * <p>
 * Objects created while a scope is open are added to the innermost network. Construction is
 * single-threaded; each thread sees only its own stack.
 */
public final class NetworkContext {

    private static final ThreadLocal<Deque<Network>> STACK = ThreadLocal.withInitial(ArrayDeque::new);

    private NetworkContext() {
    }

    static void push(Network network) {
        STACK.get().push(network);
    }

    /**
     * Closes the scope of {@code network}. Scopes left open inside it are discarded with it, so a
     * failed construction cannot leak scopes into later ones.
     *
     * @throws IllegalStateException if {@code network} was not the innermost open scope, or is not open at all.
     */
    static void pop(Network network) {
        Deque<Network> stack = STACK.get();
        Network innermost = stack.peek();
        if (innermost == network) {
            stack.pop();
            return;
        }
        if (!containsIdentical(stack, network)) {
            throw new IllegalStateException("Cannot close the scope of " + network + ": it is not open.");
        }
        List<Network> unclosed = new ArrayList<>();
        while (stack.peek() != network) {
            unclosed.add(stack.pop());
        }
        stack.pop();
        throw new IllegalStateException("Cannot close the scope of " + network
                + ": it is not the innermost open network (innermost is " + innermost
                + "). Discarded unclosed scopes " + unclosed + ".");
    }

    private static boolean containsIdentical(Deque<Network> stack, Network network) {
        for (Network open : stack) {
            if (open == network) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return The innermost open network, or empty if no scope is open.
     */
    public static Optional<Network> current() {
        return Optional.ofNullable(STACK.get().peek());
    }

    /**
     * Finds the innermost open network of a given type.
     *
     * @param type The network type.
     * @param <T>  The network type.
     * @return The innermost open network assignable to {@code type}, or empty.
     */
    public static <T extends Network> Optional<T> innermost(Class<T> type) {
        for (Network network : STACK.get()) {
            if (type.isInstance(network)) {
                return Optional.of(type.cast(network));
            }
        }
        return Optional.empty();
    }

    /**
     * @return The number of open scopes on this thread.
     */
    public static int depth() {
        return STACK.get().size();
    }
}
