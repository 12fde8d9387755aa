package com.counteragent.argumentation.core;

public enum Label {
    IN,
    OUT,
    UNDEC
}
