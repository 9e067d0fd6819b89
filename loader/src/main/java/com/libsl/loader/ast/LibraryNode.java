package com.libsl.loader.ast;

import java.util.List;
import java.util.Objects;

/** Syntax tree of one specification file, in declaration order. */
public final class LibraryNode {
    private final HeaderNode header;
    private final List<String> imports;
    private final List<String> includes;
    private final List<DeclarationNode> declarations;

    public LibraryNode(
            HeaderNode header,
            List<String> imports,
            List<String> includes,
            List<DeclarationNode> declarations) {
        this.header = Objects.requireNonNull(header, "header");
        this.imports = List.copyOf(imports);
        this.includes = List.copyOf(includes);
        this.declarations = List.copyOf(declarations);
    }

    public HeaderNode getHeader() {
        return header;
    }

    public List<String> getImports() {
        return imports;
    }

    public List<String> getIncludes() {
        return includes;
    }

    public List<DeclarationNode> getDeclarations() {
        return declarations;
    }
}
