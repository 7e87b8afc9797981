package com.example.structdiff.model;

/** Aligned element positions: {@code left} in the original sequence, {@code right} in the target. */
public record IndexPair(int left, int right) {}
