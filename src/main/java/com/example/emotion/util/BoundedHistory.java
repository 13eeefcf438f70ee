package com.example.emotion.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * 固定容量环形缓冲区
 * <p>
 * 容量在构造时确定且不可扩展，写满后覆盖最旧的元素。非线程安全，由所属会话串行写入。
 */
public final class BoundedHistory<T> {

    private final Object[] slots;
    private int head;
    private int size;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("容量必须大于0: " + capacity);
        }
        this.slots = new Object[capacity];
    }

    public void add(T value) {
        slots[(head + size) % slots.length] = value;
        if (size < slots.length) {
            size++;
        } else {
            head = (head + 1) % slots.length;
        }
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == slots.length;
    }

    @SuppressWarnings("unchecked")
    public T get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + ", size " + size);
        }
        return (T) slots[(head + index) % slots.length];
    }

    public T latest() {
        return size == 0 ? null : get(size - 1);
    }

    public int count(Predicate<? super T> predicate) {
        int matches = 0;
        for (int i = 0; i < size; i++) {
            if (predicate.test(get(i))) {
                matches++;
            }
        }
        return matches;
    }

    /**
     * 按从旧到新的顺序返回只读快照
     */
    public List<T> snapshot() {
        List<T> copy = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            copy.add(get(i));
        }
        return Collections.unmodifiableList(copy);
    }
}
