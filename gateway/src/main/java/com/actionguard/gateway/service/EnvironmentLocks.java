package com.actionguard.gateway.service;

import com.actionguard.gateway.workspace.TargetEnvironment;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per environment: a batch (snapshot, execute, audit) and a restore
 * of the same workspace never overlap. Different environments do not block
 * each other. In-process only.
 */
class EnvironmentLocks {

    private final Map<TargetEnvironment, ReentrantLock> locks = new EnumMap<>(TargetEnvironment.class);

    EnvironmentLocks() {
        for (TargetEnvironment env : TargetEnvironment.values()) {
            locks.put(env, new ReentrantLock());
        }
    }

    <T> T withLock(TargetEnvironment env, Supplier<T> work) {
        ReentrantLock lock = locks.get(env);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
