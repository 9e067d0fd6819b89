package com.libsl.loader.ast;

import java.util.List;

public final class EnumTypeNode extends TypeDeclarationNode {
    private final List<EnumEntryNode> entries;

    public EnumTypeNode(SourceLocation location, String name, List<EnumEntryNode> entries) {
        super(location, name);
        this.entries = List.copyOf(entries);
    }

    public List<EnumEntryNode> getEntries() {
        return entries;
    }
}
