package com.greenwashradar.pipeline.service.orchestration;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-job-key mutual exclusion inside this process. Acquisition never waits.
 * <p>
 * Locking and unlocking both run inside {@code compute} for the key, so an entry can be
 * dropped on release without a second holder slipping in through a stale reference.
 * Only keys that are currently held stay in the map.
 */
@Component
public class JobLockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public Optional<JobLock> tryAcquire(String jobKey) {
        boolean[] acquired = new boolean[1];
        ReentrantLock lock = locks.compute(jobKey, (key, existing) -> {
            ReentrantLock candidate = existing != null ? existing : new ReentrantLock();
            acquired[0] = candidate.tryLock();
            return candidate;
        });
        if (!acquired[0]) {
            return Optional.empty();
        }
        return Optional.of(new JobLock(jobKey, lock));
    }

    private void release(String jobKey, ReentrantLock lock) {
        locks.compute(jobKey, (key, current) -> {
            lock.unlock();
            // 재진입 보유가 남아 있으면 유지
            return current == lock && !lock.isLocked() ? null : current;
        });
    }

    public final class JobLock implements AutoCloseable {

        private final String jobKey;
        private final ReentrantLock lock;

        private JobLock(String jobKey, ReentrantLock lock) {
            this.jobKey = jobKey;
            this.lock = lock;
        }

        @Override
        public void close() {
            release(jobKey, lock);
        }
    }
}
