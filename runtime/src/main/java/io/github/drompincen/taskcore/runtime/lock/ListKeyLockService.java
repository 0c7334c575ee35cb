package io.github.drompincen.taskcore.runtime.lock;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process serialization of board mutations per list-key. Several keys are always acquired
 * in lexicographic order so two cross-list moves cannot deadlock.
 * <p>
 * Task locks guard the one-active-row-per-task rule across lists. They live in their own
 * namespace and are always taken before any list-key lock, never while holding one.
 */
@Service
public class ListKeyLockService {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> taskLocks = new ConcurrentHashMap<>();

    public <T> T withLock(String listKey, Supplier<T> action) {
        return withLocks(List.of(listKey), action);
    }

    public <T> T withLocks(Collection<String> listKeys, Supplier<T> action) {
        List<ReentrantLock> held = new ArrayList<>();
        try {
            for (String key : new TreeSet<>(listKeys)) {
                ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
                lock.lock();
                held.add(lock);
            }
            return action.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    public <T> T withTaskLock(String taskId, Supplier<T> action) {
        ReentrantLock lock = taskLocks.computeIfAbsent(taskId, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isTaskLockHeldByCurrentThread(String taskId) {
        ReentrantLock lock = taskLocks.get(taskId);
        return lock != null && lock.isHeldByCurrentThread();
    }

    public boolean isLocked(String listKey) {
        ReentrantLock lock = locks.get(listKey);
        return lock != null && lock.isLocked();
    }

    public boolean isHeldByCurrentThread(String listKey) {
        ReentrantLock lock = locks.get(listKey);
        return lock != null && lock.isHeldByCurrentThread();
    }
}
