package de.ovgu.bugfixminimizer.data;

/**
 * Why a file pair does not take part in counting.
 */
public enum ExclusionReason {
    /**
     * Both sides are empty or absent.
     */
    EMPTY,
    /**
     * Before and after are the same text.
     */
    IDENTICAL,
    /**
     * Test code, and the bug under study is not in the test suite.
     */
    TEST_NOT_BUG,
    /**
     * An artifact regenerated mechanically from source code, e.g. a JSON mock.
     */
    DERIVED_MOCK,
    /**
     * One of the sides cannot be decoded as text.  Unlike the other reasons this one signals a problem that the
     * curator must inspect manually.
     */
    UNDECODABLE;

    public boolean isError() {
        return this == UNDECODABLE;
    }
}
