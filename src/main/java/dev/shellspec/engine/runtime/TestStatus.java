package dev.shellspec.engine.runtime;

/**
 * Status reported to consumers of the result stream.
 */
public enum TestStatus {
    PASS,
    FAIL,
    SKIP,
    TODO
}
