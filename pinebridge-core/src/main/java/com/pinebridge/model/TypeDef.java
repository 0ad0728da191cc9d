package com.pinebridge.model;

import java.util.List;

/**
 * A user-declared composite type ({@code type Name} with indented fields).
 */
public record TypeDef(String name, List<String> fields, int line) {

    public TypeDef {
        fields = List.copyOf(fields);
    }
}
