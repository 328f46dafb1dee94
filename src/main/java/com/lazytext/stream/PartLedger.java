package com.lazytext.stream;

import java.util.Arrays;

/**
 * 长度切分产生的分片计数账本：每个被输出的原始行对应一个条目，记录其分片数量。
 *
 * 只追加、按先进先出顺序消费。条目在该行任何分片输出之前写入，
 * 因此下游读到某个分片时，对应条目一定已存在。
 */
public final class PartLedger {

    private int[] entries = new int[32];
    private int size;
    private int cursor;
    private long totalParts;

    void append(int parts) {
        if (parts <= 0) {
            throw new IllegalArgumentException("分片数量必须为正: " + parts);
        }
        if (size == entries.length) {
            entries = Arrays.copyOf(entries, entries.length * 2 + 1);
        }
        entries[size++] = parts;
        totalParts += parts;
    }

    /**
     * 返回游标处原始行的分片数量。
     *
     * @throws IllegalStateException 账本尚未记录到游标所指的行
     */
    int current() {
        if (cursor >= size) {
            throw new IllegalStateException("分片账本缺少第 " + cursor + " 行的记录，join 超前于 pre");
        }
        return entries[cursor];
    }

    void advance() {
        current();
        cursor++;
    }

    public int get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("账本下标越界: " + index + ", size=" + size);
        }
        return entries[index];
    }

    /**
     * 已记录的原始行数。
     */
    public int size() {
        return size;
    }

    /**
     * 已被 join 还原的原始行数。
     */
    public int consumed() {
        return cursor;
    }

    /**
     * 所有条目之和，即已输出的分片总数。
     */
    public long totalParts() {
        return totalParts;
    }
}
