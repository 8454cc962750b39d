package com.shelfsync.converter.service.queue;

public class QueueFullException extends RuntimeException {
    private final int capacity;

    public QueueFullException(int capacity) {
        super("Sync queue is full (" + capacity + " pending tasks)");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
