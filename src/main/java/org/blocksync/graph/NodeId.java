package org.blocksync.graph;

/**
 * Stable opaque identity of a node within one {@link Graph}.
 *
 * @param value the numeric identity, unique per graph.
 */
public record NodeId(long value) implements Comparable<NodeId> {

    @Override
    public int compareTo(NodeId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
