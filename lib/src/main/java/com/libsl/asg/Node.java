package com.libsl.asg;

/**
 * Base of every node in the semantic graph. The parent link is set when a node is attached to its owner and never
 * changes afterwards.
 */
public abstract class Node {
    private Node parent;

    /** Owning node, or {@code null} for the library root and for nodes not attached yet. */
    public Node getParent() {
        return parent;
    }

    protected final <T extends Node> T adopt(T child) {
        if (child == null) {
            return null;
        }
        Node node = child;
        if (node.parent != null && node.parent != this) {
            throw new IllegalStateException(
                    node.getClass().getSimpleName()
                            + " is already attached to "
                            + node.parent.getClass().getSimpleName());
        }
        node.parent = this;
        return child;
    }
}
