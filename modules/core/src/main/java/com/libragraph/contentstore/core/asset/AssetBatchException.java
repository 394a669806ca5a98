package com.libragraph.contentstore.core.asset;

import java.util.List;
import java.util.Map;

/**
 * At least one asset in a batch failed, so the batch produced no summary.
 *
 * <p>{@link #failures()} lists every failed asset in the order it failed;
 * the cause is the first of them.
 */
public class AssetBatchException extends RuntimeException {

    private final List<Map.Entry<String, Throwable>> failures;

    public AssetBatchException(List<Map.Entry<String, Throwable>> failures) {
        super("Unable to upload " + failures.size() + " asset(s), first: "
                + failures.get(0).getKey(), failures.get(0).getValue());
        this.failures = List.copyOf(failures);
    }

    /** Original name to failure, in failure order. */
    public List<Map.Entry<String, Throwable>> failures() {
        return failures;
    }
}
