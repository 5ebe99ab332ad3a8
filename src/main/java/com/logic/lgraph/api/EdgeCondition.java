package com.logic.lgraph.api;

/** Decides whether a value may flow across an edge. */
@FunctionalInterface
public interface EdgeCondition {
    boolean test(double sourceValue);
}
