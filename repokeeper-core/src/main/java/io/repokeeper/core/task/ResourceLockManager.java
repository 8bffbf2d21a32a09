package io.repokeeper.core.task;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

/**
 * FIFO lock queues keyed by resource.
 *
 * A task holds all of its keys once it is at the head of the queue of every
 * key. Admission appends the task to all of its queues in one step, so two
 * tasks sharing keys always hold them in submission order and no cycle can
 * form between them.
 *
 * Not thread-safe. The caller synchronizes.
 */
class ResourceLockManager
{
    private final Map<String, ArrayDeque<Long>> queues = new HashMap<>();
    private final Map<Long, SortedSet<String>> owners = new HashMap<>();

    /**
     * Queues a task. Returns true if the task holds every key right away.
     */
    boolean admit(long taskId, SortedSet<String> keys)
    {
        if (owners.containsKey(taskId)) {
            throw new IllegalStateException("Task " + taskId + " is already admitted");
        }
        owners.put(taskId, ImmutableSortedSet.copyOfSorted(keys));
        for (String key : keys) {
            queues.computeIfAbsent(key, k -> new ArrayDeque<>()).addLast(taskId);
        }
        return holdsAll(taskId);
    }

    /**
     * Removes a finished task from its queues. Returns ids of tasks that hold
     * all of their keys because of this release, in id order.
     */
    List<Long> release(long taskId)
    {
        SortedSet<String> keys = owners.remove(taskId);
        if (keys == null) {
            return ImmutableList.of();
        }
        Set<Long> candidates = new LinkedHashSet<>();
        for (String key : keys) {
            ArrayDeque<Long> queue = queues.get(key);
            boolean wasHead = taskId == queue.peekFirst();
            queue.remove(taskId);
            if (queue.isEmpty()) {
                queues.remove(key);
            }
            else if (wasHead) {
                candidates.add(queue.peekFirst());
            }
        }
        List<Long> runnable = new ArrayList<>();
        for (long candidate : candidates) {
            if (holdsAll(candidate)) {
                runnable.add(candidate);
            }
        }
        runnable.sort(null);
        return runnable;
    }

    boolean holdsAll(long taskId)
    {
        SortedSet<String> keys = owners.get(taskId);
        if (keys == null) {
            return false;
        }
        for (String key : keys) {
            Long head = queues.get(key).peekFirst();
            if (head == null || head != taskId) {
                return false;
            }
        }
        return true;
    }

    int queuedTaskCount()
    {
        return owners.size();
    }
}
