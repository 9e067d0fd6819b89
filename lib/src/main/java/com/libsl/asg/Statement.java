package com.libsl.asg;

public abstract sealed class Statement extends Node permits Assignment, Action {}
