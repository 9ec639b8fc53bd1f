package com.adlanda.contextengine.model;

import java.util.List;

/**
 * Per-item outcome of a batch operation. Batches are not atomic.
 *
 * @param succeeded Items that were written
 * @param failed    Items that were rejected, with their input position
 */
public record BatchResult<T>(
        List<T> succeeded,
        List<Failure> failed
) {
    public BatchResult {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }

    /**
     * @param index  Position of the item in the request list
     * @param reason Why it failed
     */
    public record Failure(int index, String reason) {}
}
