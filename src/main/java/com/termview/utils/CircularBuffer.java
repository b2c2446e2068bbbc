/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.termview.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed-capacity ring buffer; once full, each add overwrites the oldest entry.
 * All access is synchronized on the buffer itself.
 *
 * @param <T> element type
 */
public class CircularBuffer<T> {

    private final Object[] slots;
    private int next = 0;
    private int count = 0;

    /**
     * @param capacity maximum number of retained elements
     * @throws IllegalArgumentException if capacity is less than 1
     */
    public CircularBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.slots = new Object[capacity];
    }

    public synchronized void add(T element) {
        slots[next] = element;
        next = (next + 1) % slots.length;
        if (count < slots.length) {
            count++;
        }
    }

    /**
     * Returns up to {@code n} of the newest elements, oldest first.
     *
     * @throws IllegalArgumentException if n is negative
     */
    @SuppressWarnings("unchecked")
    public synchronized List<T> getLast(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Count cannot be negative");
        }
        int take = Math.min(n, count);
        List<T> out = new ArrayList<>(take);
        // next always points one past the newest element
        int start = (next - take + slots.length) % slots.length;
        for (int i = 0; i < take; i++) {
            out.add((T) slots[(start + i) % slots.length]);
        }
        return out;
    }

    public synchronized List<T> getAll() {
        return getLast(count);
    }

    public synchronized int size() {
        return count;
    }

    public int capacity() {
        return slots.length;
    }

    public synchronized void clear() {
        Arrays.fill(slots, null);
        next = 0;
        count = 0;
    }
}
