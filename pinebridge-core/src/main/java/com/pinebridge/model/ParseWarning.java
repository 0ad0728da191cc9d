package com.pinebridge.model;

/**
 * A statement the parser skipped. Parsing continues past it.
 */
public record ParseWarning(int line, String statement, String reason) {}
