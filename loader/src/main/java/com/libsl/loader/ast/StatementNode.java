package com.libsl.loader.ast;

public sealed interface StatementNode permits AssignmentNode, ActionNode {

    SourceLocation getLocation();
}
