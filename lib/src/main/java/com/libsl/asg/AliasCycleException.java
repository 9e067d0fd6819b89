package com.libsl.asg;

import java.util.List;

public final class AliasCycleException extends SemanticException {
    private final List<String> chain;

    public AliasCycleException(List<String> chain) {
        super("type alias cycle: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> getChain() {
        return chain;
    }
}
