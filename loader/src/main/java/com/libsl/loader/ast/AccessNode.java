package com.libsl.loader.ast;

import java.util.List;
import java.util.Objects;

/**
 * Access path as written, e.g. {@code a.b[0].c} or {@code Automaton(arg).field}. For the getter form the head is
 * the automaton name and {@link #getGetterArgument()} names the argument.
 */
public final class AccessNode implements ExpressionNode {
    private final SourceLocation location;
    private final String head;
    private final String getterArgument;
    private final List<AccessSegmentNode> segments;

    public AccessNode(
            SourceLocation location, String head, String getterArgument, List<AccessSegmentNode> segments) {
        this.location = Objects.requireNonNull(location, "location");
        this.head = Objects.requireNonNull(head, "head");
        this.getterArgument = getterArgument;
        this.segments = List.copyOf(segments);
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public String getHead() {
        return head;
    }

    public String getGetterArgument() {
        return getterArgument;
    }

    public boolean isAutomatonGetter() {
        return getterArgument != null;
    }

    public List<AccessSegmentNode> getSegments() {
        return segments;
    }

    /** {@code true} for a lone identifier without segments. */
    public boolean isSimpleName() {
        return getterArgument == null && segments.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder(head);
        if (getterArgument != null) {
            text.append('(').append(getterArgument).append(')');
        }
        for (AccessSegmentNode segment : segments) {
            text.append(segment);
        }
        return text.toString();
    }
}
