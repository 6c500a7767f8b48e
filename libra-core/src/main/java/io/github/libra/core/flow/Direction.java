package io.github.libra.core.flow;

/**
 * The direction in which facts propagate along control-flow edges.
 */
public enum Direction {
    /**
     * From a block's predecessors into its incoming state, through its instructions in order.
     */
    FORWARD,
    /**
     * From a block's successors into its outgoing state, through its instructions in reverse.
     */
    BACKWARD,
}
