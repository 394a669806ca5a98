package com.libragraph.contentstore.core.backend;

/**
 * Terminal outcome of one fork-join branch.
 *
 * @param item    the branch result, null on failure (or for void branches)
 * @param failure the branch failure, null on success
 * @param branch  index of the branch in the list that was forked
 * @param order   position in which this branch settled relative to its siblings (0 = first)
 */
public record Settled<T>(T item, Throwable failure, int branch, int order) {

    public boolean failed() {
        return failure != null;
    }
}
