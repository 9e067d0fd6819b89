package com.libsl.asg;

import com.libsl.asg.type.Type;

public final class GlobalVariableDeclaration extends Variable {
    public GlobalVariableDeclaration(String name, Type type) {
        super(name, type);
    }
}
