package com.example.sessionhub.hub.service;

import java.util.AbstractQueue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;

/**
 * Bounded queue that never rejects an element: when full, the oldest element is evicted to make room.
 * All operations are synchronized so one thread may offer while another polls.
 */
final class DropOldestQueue<E> extends AbstractQueue<E> {

    private final ArrayDeque<E> elements;
    private final int capacity;
    private long dropped;

    DropOldestQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.elements = new ArrayDeque<>(capacity);
    }

    @Override
    public synchronized boolean offer(E e) {
        if (e == null) {
            throw new NullPointerException();
        }
        if (elements.size() == capacity) {
            elements.pollFirst();
            dropped++;
        }
        elements.offerLast(e);
        return true;
    }

    @Override
    public synchronized E poll() {
        return elements.pollFirst();
    }

    @Override
    public synchronized E peek() {
        return elements.peekFirst();
    }

    @Override
    public synchronized int size() {
        return elements.size();
    }

    @Override
    public synchronized void clear() {
        elements.clear();
    }

    /** Snapshot iterator; does not reflect later changes. */
    @Override
    public synchronized Iterator<E> iterator() {
        return new ArrayList<>(elements).iterator();
    }

    synchronized long dropped() {
        return dropped;
    }

    int capacity() {
        return capacity;
    }
}
