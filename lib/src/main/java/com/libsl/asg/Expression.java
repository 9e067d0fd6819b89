package com.libsl.asg;

public abstract sealed class Expression extends Node
        permits BinaryOpExpression, UnaryOpExpression, Variable, Atomic, OldValue {}
