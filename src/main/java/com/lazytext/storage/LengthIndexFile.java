package com.lazytext.storage;

import com.lazytext.config.Constants;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 长度索引文件读写。
 *
 * 文件布局（大端序）：
 * <pre>
 * int   magic "LTLN"
 * short version
 * byte  id 位宽（字节）
 * long  行数 n
 * n 个定宽整数，按行序排列
 * </pre>
 */
final class LengthIndexFile {

    /** 文件头字节数 */
    static final int HEADER_BYTES = Integer.BYTES + Short.BYTES + Byte.BYTES + Long.BYTES;

    private LengthIndexFile() {
    }

    /**
     * 读取结果：位宽与各行长度。
     */
    record Contents(IdWidth width, long[] lengths) {
    }

    /**
     * 写入长度索引。
     *
     * 先写入同目录下的临时文件，完整写完后原子改名为目标文件；
     * 写入失败时目标文件不存在。
     *
     * @throws IOException 写入失败或某行长度超出位宽时抛出
     */
    static void write(Path path, long[] lengths, IdWidth width) throws IOException {
        for (long length : lengths) {
            if (length > width.maxValue()) {
                throw new IOException("行长度超出 id 位宽: length=" + length + ", width=" + width);
            }
        }
        Path tempPath = tempPath(path);
        try {
            writeContents(tempPath, lengths, width);
            Files.move(tempPath, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException exception) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupFailure) {
                exception.addSuppressed(cleanupFailure);
            }
            throw exception;
        }
    }

    static Path tempPath(Path path) {
        return path.resolveSibling(path.getFileName() + ".tmp");
    }

    private static void writeContents(Path path, long[] lengths, IdWidth width) throws IOException {
        try (DataOutputStream output = new DataOutputStream(
            new BufferedOutputStream(Files.newOutputStream(path), Constants.WRITE_BUFFER_BYTES))) {
            output.writeInt(Constants.LENGTHS_MAGIC);
            output.writeShort(Constants.FORMAT_VERSION);
            output.writeByte(width.bytes());
            output.writeLong(lengths.length);
            for (long length : lengths) {
                switch (width) {
                    case INT16 -> output.writeShort((int) length);
                    case INT32 -> output.writeInt((int) length);
                    case INT64 -> output.writeLong(length);
                }
            }
        }
    }

    /**
     * 读取长度索引并校验文件头与文件大小。
     *
     * @throws StoreIntegrityException 文件头或条目数与文件大小不符时抛出
     */
    static Contents read(Path path) throws IOException {
        long fileSize = Files.size(path);
        if (fileSize < HEADER_BYTES) {
            throw new StoreIntegrityException("长度索引文件过短", path, HEADER_BYTES, fileSize);
        }
        try (DataInputStream input = new DataInputStream(
            new BufferedInputStream(Files.newInputStream(path), Constants.WRITE_BUFFER_BYTES))) {
            int magic = input.readInt();
            if (magic != Constants.LENGTHS_MAGIC) {
                throw new StoreIntegrityException("长度索引文件 magic 不匹配", path, Constants.LENGTHS_MAGIC, magic);
            }
            short version = input.readShort();
            if (version != Constants.FORMAT_VERSION) {
                throw new StoreIntegrityException("长度索引文件版本不支持", path, Constants.FORMAT_VERSION, version);
            }
            IdWidth width;
            int widthBytes = input.readByte();
            try {
                width = IdWidth.ofBytes(widthBytes);
            } catch (IllegalArgumentException exception) {
                throw new StoreIntegrityException("长度索引文件位宽非法", path, Constants.DEFAULT_ID_WIDTH, widthBytes);
            }
            long lineCount = input.readLong();
            long expectedSize = HEADER_BYTES + lineCount * width.bytes();
            if (lineCount < 0 || lineCount > Integer.MAX_VALUE - 8 || expectedSize != fileSize) {
                throw new StoreIntegrityException("长度索引文件大小与行数不符", path, expectedSize, fileSize);
            }

            long[] lengths = new long[(int) lineCount];
            for (int index = 0; index < lengths.length; index++) {
                long length = switch (width) {
                    case INT16 -> input.readShort();
                    case INT32 -> input.readInt();
                    case INT64 -> input.readLong();
                };
                if (length < 0) {
                    throw new StoreIntegrityException("第 " + index + " 行长度为负", path, 0, length);
                }
                lengths[index] = length;
            }
            return new Contents(width, lengths);
        } catch (EOFException exception) {
            throw new IOException("读取长度索引时遇到 EOF: " + path, exception);
        }
    }
}
