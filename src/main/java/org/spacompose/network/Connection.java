package org.spacompose.network;

/**
 * A directed link between two objects of a network.
 *
 * @param pre  The source object.
 * @param post The target object.
 */
public record Connection(Object pre, Object post) {
}
