package com.lanhub.collector.intake.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Single process-wide exclusive lock around every "list, pick a name, write" sequence in the
 * collection folders. Every writer gets the same bean injected, so there is one lock per process.
 */
@Component
public class IoSerializer {
    private static final Logger log = LoggerFactory.getLogger(IoSerializer.class);

    private final ReentrantLock lock = new ReentrantLock();

    public Handle acquire() {
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            log.debug("Waiting for io lock (queued={})", lock.getQueueLength());
        }
        lock.lock();
        log.debug("Io lock acquired by {}", Thread.currentThread().getName());
        return new Handle();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public final class Handle implements AutoCloseable {
        private boolean released;

        private Handle() {
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            lock.unlock();
            log.debug("Io lock released by {}", Thread.currentThread().getName());
        }
    }
}
