package com.example.interview.service.util;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process locks per interviewer, taken in sorted order so that two commits sharing interviewers
 * cannot deadlock.
 * <p>
 * When the action succeeds inside a transaction the locks are kept until that transaction completes,
 * so rows written by the action are visible before another commit re-checks the same interviewers.
 */
@Component
public class InterviewerLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLocks(Collection<String> interviewerIds, Supplier<T> action) {
        List<String> ordered = interviewerIds.stream().distinct().sorted().toList();
        List<ReentrantLock> held = new ArrayList<>(ordered.size());
        boolean deferred = false;
        try {
            for (String id : ordered) {
                ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
                lock.lock();
                held.add(lock);
            }
            T result = action.get();
            if (TransactionSynchronizationManager.isSynchronizationActive()) {
                TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                    @Override
                    public void afterCompletion(int status) {
                        release(held);
                    }
                });
                deferred = true;
            }
            return result;
        } finally {
            if (!deferred) {
                release(held);
            }
        }
    }

    private static void release(List<ReentrantLock> held) {
        for (int i = held.size() - 1; i >= 0; i--) {
            held.get(i).unlock();
        }
    }
}
