package com.satmobile.backend.modules.store.application;

/**
 * Outcome of a chunked write. Chunks commit in order, so {@code committed} operations are
 * always a prefix of the submitted list.
 *
 * @param attempted       operations submitted
 * @param committed       operations whose chunk committed
 * @param chunks          chunks the operations were split into
 * @param committedChunks chunks that committed before the first failure
 * @param failure         failure of the first chunk that did not commit, {@code null} when complete
 */
public record BatchWriteResult(int attempted, int committed, int chunks, int committedChunks, RuntimeException failure) {

    public static BatchWriteResult empty() {
        return new BatchWriteResult(0, 0, 0, 0, null);
    }

    public boolean isComplete() {
        return failure == null && committed == attempted;
    }

    public int uncommitted() {
        return attempted - committed;
    }
}
