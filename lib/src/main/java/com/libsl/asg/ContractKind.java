package com.libsl.asg;

public enum ContractKind {
    REQUIRES,
    ENSURES
}
