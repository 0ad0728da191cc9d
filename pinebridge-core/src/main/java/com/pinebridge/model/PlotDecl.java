package com.pinebridge.model;

/**
 * A plotting call. Kept for reporting; plots never reach generated code.
 */
public record PlotDecl(String kind, String series, String title, int line) {}
