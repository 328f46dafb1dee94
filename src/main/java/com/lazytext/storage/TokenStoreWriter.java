package com.lazytext.storage;

import com.lazytext.config.Constants;
import com.lazytext.vocab.Vocabulary;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * 单遍构建一个存储：逐行把词映射为 id 追加到 id 文件，同时在内存中记录每行长度。
 *
 * 长度索引在 {@link #finish()} 时最后写入，构建中断只会留下不成对的文件，
 * 下次打开时不会被当作可复用的存储。
 */
final class TokenStoreWriter implements AutoCloseable {

    private final Path lengthsPath;
    private final Path memmapPath;
    private final Vocabulary vocabulary;
    private final IdWidth width;
    private final FileChannel channel;
    private final ByteBuffer buffer;
    private final LongArrayBuffer lengths = new LongArrayBuffer();
    private long tokenCount;
    private boolean closed;

    TokenStoreWriter(String outputPath, Vocabulary vocabulary, IdWidth width) throws IOException {
        if (vocabulary == null) {
            throw new IllegalArgumentException("词表不能为空");
        }
        if (width == null) {
            throw new IllegalArgumentException("id 位宽不能为空");
        }
        this.lengthsPath = TokenStore.lengthsPath(outputPath);
        this.memmapPath = TokenStore.memmapPath(outputPath);
        this.vocabulary = vocabulary;
        this.width = width;

        Path parent = memmapPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        // 先删除旧的长度索引，使中断的构建不可复用
        Files.deleteIfExists(lengthsPath);
        this.channel = FileChannel.open(memmapPath,
            StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        this.buffer = ByteBuffer.allocate(Constants.WRITE_BUFFER_BYTES).order(ByteOrder.nativeOrder());
    }

    /**
     * 追加一行词序列。
     *
     * @throws IOException 写入失败或 id 超出位宽时抛出
     */
    void append(List<String> tokens) throws IOException {
        ensureOpen();
        if (tokens.size() > width.maxValue()) {
            throw new IOException("行长度超出 id 位宽: length=" + tokens.size() + ", width=" + width
                + ", line=" + lengths.size());
        }
        // 长度按映射前的词数记录
        lengths.add(tokens.size());
        for (String token : tokens) {
            long id = vocabulary.id(token);
            if (id < 0 || id > width.maxValue()) {
                throw new IOException("token id 超出位宽: id=" + id + ", width=" + width + ", file=" + memmapPath);
            }
            if (buffer.remaining() < width.bytes()) {
                flushBuffer();
            }
            width.put(buffer, id);
        }
        tokenCount += tokens.size();
    }

    int lineCount() {
        return lengths.size();
    }

    long tokenCount() {
        return tokenCount;
    }

    /**
     * 刷新 id 文件并写入长度索引，返回各行长度。
     */
    long[] finish() throws IOException {
        ensureOpen();
        flushBuffer();
        channel.force(false);
        channel.close();
        closed = true;
        long[] lineLengths = lengths.toArray();
        LengthIndexFile.write(lengthsPath, lineLengths, width);
        return lineLengths;
    }

    private void flushBuffer() throws IOException {
        buffer.flip();
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        buffer.clear();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("TokenStoreWriter 已关闭");
        }
    }

    /**
     * 放弃未完成的构建，id 文件保留但缺少长度索引。
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        channel.close();
        closed = true;
    }
}
