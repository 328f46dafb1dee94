package com.lazytext.storage;

import java.util.Arrays;

/**
 * 可增长的 long[] 缓冲，用于构建期累积每行长度。
 */
final class LongArrayBuffer {

    private long[] array;
    private int size;

    LongArrayBuffer(int initialCapacity) {
        this.array = new long[Math.max(1, initialCapacity)];
    }

    LongArrayBuffer() {
        this(1024);
    }

    void add(long value) {
        if (size == array.length) {
            if (array.length == Integer.MAX_VALUE - 8) {
                throw new IllegalStateException("行数超过上限: " + size);
            }
            int newCapacity = (int) Math.min(Integer.MAX_VALUE - 8L, array.length * 2L + 1);
            array = Arrays.copyOf(array, newCapacity);
        }
        array[size++] = value;
    }

    int size() {
        return size;
    }

    long[] toArray() {
        return Arrays.copyOf(array, size);
    }
}
