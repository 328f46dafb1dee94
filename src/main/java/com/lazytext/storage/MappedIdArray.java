package com.lazytext.storage;

import com.lazytext.config.Constants;

import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 只读映射的扁平 id 数组。
 *
 * 文件按 {@link Constants#MAP_CHUNK_BYTES} 分片映射，以支持超过 2GB 的语料；
 * 分片大小是所有位宽的整数倍，单个元素不会跨片。数组内容为本机字节序。
 */
final class MappedIdArray {

    private static final int CHUNK_SHIFT = Long.numberOfTrailingZeros(Constants.MAP_CHUNK_BYTES);

    private final IdWidth width;
    private final long elementCount;
    private final MappedByteBuffer[] chunks;

    private MappedIdArray(IdWidth width, long elementCount, MappedByteBuffer[] chunks) {
        this.width = width;
        this.elementCount = elementCount;
        this.chunks = chunks;
    }

    /**
     * 映射 id 文件，并校验元素个数与期望一致。
     *
     * @param expectedElements 长度索引之和
     * @throws StoreIntegrityException 文件大小与期望元素数不符时抛出
     */
    static MappedIdArray map(Path path, IdWidth width, long expectedElements) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long fileSize = channel.size();
            long expectedSize = expectedElements * width.bytes();
            if (fileSize != expectedSize) {
                throw new StoreIntegrityException("id 文件大小与长度索引之和不符（字节）", path, expectedSize, fileSize);
            }
            int chunkCount = (int) ((fileSize + Constants.MAP_CHUNK_BYTES - 1) >>> CHUNK_SHIFT);
            MappedByteBuffer[] chunks = new MappedByteBuffer[chunkCount];
            for (int chunkIndex = 0; chunkIndex < chunkCount; chunkIndex++) {
                long start = (long) chunkIndex << CHUNK_SHIFT;
                long size = Math.min(Constants.MAP_CHUNK_BYTES, fileSize - start);
                MappedByteBuffer chunk = channel.map(FileChannel.MapMode.READ_ONLY, start, size);
                chunk.order(ByteOrder.nativeOrder());
                chunks[chunkIndex] = chunk;
            }
            return new MappedIdArray(width, expectedElements, chunks);
        }
    }

    long size() {
        return elementCount;
    }

    long get(long index) {
        long bytePosition = index * width.bytes();
        MappedByteBuffer chunk = chunks[(int) (bytePosition >>> CHUNK_SHIFT)];
        return width.get(chunk, (int) (bytePosition & (Constants.MAP_CHUNK_BYTES - 1)));
    }

    /**
     * 复制 [offset, offset + length) 区间的 id。
     */
    long[] slice(long offset, int length) {
        long[] ids = new long[length];
        for (int index = 0; index < length; index++) {
            ids[index] = get(offset + index);
        }
        return ids;
    }
}
