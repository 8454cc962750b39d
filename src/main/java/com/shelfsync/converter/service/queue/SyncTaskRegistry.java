package com.shelfsync.converter.service.queue;

import com.shelfsync.converter.model.SyncTask;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Recently accepted tasks by id, oldest evicted first. */
public class SyncTaskRegistry {
    static final int DEFAULT_RETAINED = 200;

    private final Map<String, SyncTask> tasks;

    public SyncTaskRegistry() {
        this(DEFAULT_RETAINED);
    }

    public SyncTaskRegistry(int retained) {
        this.tasks = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, SyncTask> eldest) {
                return size() > retained && eldest.getValue().getState().isTerminal();
            }
        };
    }

    public synchronized void put(SyncTask task) {
        if (task != null) tasks.put(task.getId(), task);
    }

    public synchronized Optional<SyncTask> get(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public synchronized int size() {
        return tasks.size();
    }
}
