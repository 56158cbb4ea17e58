// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htslc.cli;

import java.io.PrintStream;
import java.util.concurrent.locks.ReentrantLock;
import htslc.util.SneakyThrow;

final class Streams implements AutoCloseable {
    // The corresponding unlock is in close(), so this is fine.
    @SuppressWarnings("LockAcquiredButNotSafelyReleased")
    private Streams(final PrintStream out, final PrintStream err) {
        try {
            lock.lockInterruptibly();
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        }
        this.out = out;
        this.err = err;
    }

    static Streams acquire(final PrintStream out, final PrintStream err) {
        return new Streams(out, err);
    }

    @Override
    public void close() {
        lock.unlock();
    }

    PrintStream out() {
        return out;
    }

    PrintStream err() {
        return err;
    }

    private static final ReentrantLock lock = new ReentrantLock();

    private final PrintStream out;
    private final PrintStream err;
}
