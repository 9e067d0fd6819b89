package com.libsl.loader.ast;

public sealed interface ExpressionNode
        permits BinaryExpressionNode,
                UnaryExpressionNode,
                LiteralNode,
                AccessNode,
                OldValueNode,
                ConstructorCallNode {

    SourceLocation getLocation();
}
