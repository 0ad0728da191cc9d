package com.pinebridge.model;

public enum Direction {
    LONG,
    SHORT,
    NONE
}
