package com.libsl.loader.ast;

/** Top-level declaration of a specification file. */
public sealed interface DeclarationNode permits TypeDeclarationNode, AutomatonNode, FunctionNode, VariableNode {

    SourceLocation getLocation();

    String getName();
}
