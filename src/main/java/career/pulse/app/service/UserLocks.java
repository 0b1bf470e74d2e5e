package career.pulse.app.service;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of locks shared by all users. A user always maps to the same lock, so
 * work for one user is serialized; unrelated users occasionally share a lock.
 * Memory stays constant however many users connect.
 */
final class UserLocks {
    static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    UserLocks() {
        this(DEFAULT_STRIPES);
    }

    UserLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    ReentrantLock forUser(String userId) {
        int hash = userId != null ? userId.hashCode() : 0;
        return stripes[Math.floorMod(hash ^ (hash >>> 16), stripes.length)];
    }

    int stripeCount() {
        return stripes.length;
    }
}
