package io.tagkeeper.engine;

import io.tagkeeper.model.Subject;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped locks serializing writes per subject within this process.
 * Two subjects may share a stripe; that only costs concurrency.
 */
public final class SubjectLocks {
    private static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public SubjectLocks() {
        this(DEFAULT_STRIPES);
    }

    public SubjectLocks(int stripes) {
        this.stripes = new ReentrantLock[Math.max(1, stripes)];
        for (int i = 0; i < this.stripes.length; i++) {
            this.stripes[i] = new ReentrantLock();
        }
    }

    public ReentrantLock lockFor(Subject subject) {
        int idx = (subject.hashCode() & 0x7fffffff) % stripes.length;
        return stripes[idx];
    }
}
