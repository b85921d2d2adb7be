package me.golemcore.memory.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per user. Serializes every mutation of a user's views
 * and concepts; different users never contend.
 */
@Component
public class UserPartitionLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withUserLock(String userId, Supplier<T> action) {
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithUserLock(String userId, Runnable action) {
        withUserLock(userId, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Runs the action only if no other thread currently holds the user's lock.
     */
    public <T> Optional<T> tryWithUserLock(String userId, Supplier<T> action) {
        ReentrantLock lock = lockFor(userId);
        if (!lock.tryLock()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(action.get());
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String userId) {
        ReentrantLock lock = locks.get(userId);
        return lock != null && lock.isLocked();
    }

    private ReentrantLock lockFor(String userId) {
        return locks.computeIfAbsent(userId, id -> new ReentrantLock());
    }
}
