package com.lazytext.storage;

import java.nio.ByteBuffer;

/**
 * 磁盘上 token id 的定宽整数类型。
 */
public enum IdWidth {
    INT16(Short.BYTES, Short.MAX_VALUE),
    INT32(Integer.BYTES, Integer.MAX_VALUE),
    INT64(Long.BYTES, Long.MAX_VALUE);

    private final int bytes;
    private final long maxValue;

    IdWidth(int bytes, long maxValue) {
        this.bytes = bytes;
        this.maxValue = maxValue;
    }

    public int bytes() {
        return bytes;
    }

    public long maxValue() {
        return maxValue;
    }

    /**
     * 按字节数查找位宽。
     *
     * @throws IllegalArgumentException 不支持的字节数
     */
    public static IdWidth ofBytes(int bytes) {
        for (IdWidth width : values()) {
            if (width.bytes == bytes) {
                return width;
            }
        }
        throw new IllegalArgumentException("不支持的 id 位宽: " + bytes + " 字节");
    }

    void put(ByteBuffer buffer, long value) {
        switch (this) {
            case INT16 -> buffer.putShort((short) value);
            case INT32 -> buffer.putInt((int) value);
            case INT64 -> buffer.putLong(value);
        }
    }

    long get(ByteBuffer buffer, int byteOffset) {
        return switch (this) {
            case INT16 -> buffer.getShort(byteOffset);
            case INT32 -> buffer.getInt(byteOffset);
            case INT64 -> buffer.getLong(byteOffset);
        };
    }
}
