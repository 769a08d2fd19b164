package com.typewarden.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The single mutual-exclusion point shared by replacement transactions and
 * monitor ticks. A monitor probe never observes a half-written batch.
 */
@Component
public class CampaignLock {

    private static final Logger log = LoggerFactory.getLogger(CampaignLock.class);

    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T runExclusive(String owner, Supplier<T> work) {
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            log.debug("{} waiting for campaign lock", owner);
        }
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeld() {
        return lock.isLocked();
    }
}
