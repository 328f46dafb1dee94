package com.lazytext.storage;

import com.lazytext.config.Constants;
import com.lazytext.config.CorpusConfig;
import com.lazytext.vocab.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * 磁盘上的分词语料：扁平 id 数组（内存映射）加每行长度索引。
 *
 * 两个文件由 outputPath 前缀派生：{@code <outputPath>.lengths.bin} 与 {@code <outputPath>.memmap}。
 * 构建完成后只读，任意行可按下标 O(1) 定位。同一路径不支持并发构建。
 */
public final class TokenStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TokenStore.class);

    private final String outputPath;
    private final Vocabulary vocabulary;
    private final IdWidth width;
    private final long[] lengths;
    private final long[] offsets;
    private MappedIdArray ids;

    private TokenStore(String outputPath, Vocabulary vocabulary, IdWidth width, long[] lengths, MappedIdArray ids) {
        this.outputPath = outputPath;
        this.vocabulary = vocabulary;
        this.width = width;
        this.lengths = lengths;
        this.offsets = makeOffsets(lengths);
        this.ids = ids;
    }

    public static Path lengthsPath(String outputPath) {
        return Paths.get(requireOutputPath(outputPath) + Constants.LENGTHS_SUFFIX);
    }

    public static Path memmapPath(String outputPath) {
        return Paths.get(requireOutputPath(outputPath) + Constants.MEMMAP_SUFFIX);
    }

    /**
     * 两个文件是否都存在；只存在其一视为需要重建。
     */
    public static boolean artifactsExist(String outputPath) {
        boolean lengthsExist = Files.isRegularFile(lengthsPath(outputPath));
        boolean memmapExists = Files.isRegularFile(memmapPath(outputPath));
        if (lengthsExist != memmapExists) {
            logger.warn("存储文件不成对，将重建: {} (lengths={}, memmap={})",
                outputPath, lengthsExist, memmapExists);
        }
        return lengthsExist && memmapExists;
    }

    /**
     * 单遍消费词序列流，写出两个文件并返回可读的存储。
     *
     * @param lines 每个元素是一行的词列表，只消费一次
     * @throws IOException 写入失败时抛出
     */
    public static TokenStore build(Iterator<? extends List<String>> lines, Vocabulary vocabulary,
                                   String outputPath, IdWidth width) throws IOException {
        Objects.requireNonNull(lines, "lines 不能为空");
        logger.info("开始构建存储: {}", outputPath);
        long[] lineLengths;
        try (TokenStoreWriter writer = new TokenStoreWriter(outputPath, vocabulary, width)) {
            while (lines.hasNext()) {
                writer.append(lines.next());
            }
            lineLengths = writer.finish();
            logger.info("存储构建完成: {} (lines={}, tokens={})", outputPath, writer.lineCount(), writer.tokenCount());
        }
        return attach(outputPath, vocabulary, width, lineLengths);
    }

    /**
     * 加载已有存储：读入长度索引，映射 id 文件并立即校验两者一致。
     *
     * @throws java.nio.file.NoSuchFileException 任一文件不存在
     * @throws StoreIntegrityException 长度之和与 id 文件大小不符
     */
    public static TokenStore load(String outputPath, Vocabulary vocabulary) throws IOException {
        if (vocabulary == null) {
            throw new IllegalArgumentException("词表不能为空");
        }
        LengthIndexFile.Contents contents = LengthIndexFile.read(lengthsPath(outputPath));
        logger.info("加载存储: {} (lines={})", memmapPath(outputPath), contents.lengths().length);
        return attach(outputPath, vocabulary, contents.width(), contents.lengths());
    }

    /**
     * reuse 为 true 且两个文件都存在时直接加载（不触碰 lines），否则重新构建。
     */
    public static TokenStore buildOrReuse(Iterator<? extends List<String>> lines, Vocabulary vocabulary,
                                          String outputPath, IdWidth width, boolean reuse) throws IOException {
        if (reuse && artifactsExist(outputPath)) {
            TokenStore store = load(outputPath, vocabulary);
            if (store.idWidth() != width) {
                logger.warn("复用的存储位宽为 {}，与请求的 {} 不同: {}", store.idWidth(), width, outputPath);
            }
            return store;
        }
        return build(lines, vocabulary, outputPath, width);
    }

    /**
     * 按配置中的 outputPath、idWidth 与 reuse 构建或复用。
     */
    public static TokenStore open(Iterator<? extends List<String>> lines, Vocabulary vocabulary,
                                  CorpusConfig config) throws IOException {
        config.validate();
        return buildOrReuse(lines, vocabulary, config.getOutputPath(),
            IdWidth.ofBytes(config.getIdWidth()), config.isReuse());
    }

    private static TokenStore attach(String outputPath, Vocabulary vocabulary, IdWidth width, long[] lengths)
        throws IOException {
        long total = 0;
        for (long length : lengths) {
            total += length;
        }
        MappedIdArray mapped = MappedIdArray.map(memmapPath(outputPath), width, total);
        return new TokenStore(outputPath, vocabulary, width, lengths, mapped);
    }

    static long[] makeOffsets(long[] lengths) {
        long[] offsets = new long[lengths.length + 1];
        for (int index = 0; index < lengths.length; index++) {
            offsets[index + 1] = offsets[index] + lengths[index];
        }
        return offsets;
    }

    private static String requireOutputPath(String outputPath) {
        if (outputPath == null || outputPath.isBlank()) {
            throw new IllegalArgumentException("outputPath 不能为空");
        }
        return outputPath;
    }

    /**
     * 行数。
     */
    public int size() {
        return lengths.length;
    }

    /**
     * 第 index 行的 id 序列。
     *
     * @throws IndexOutOfBoundsException index 越界
     */
    public long[] ids(int index) {
        Objects.checkIndex(index, lengths.length);
        return mapped().slice(offsets[index], (int) lengths[index]);
    }

    /**
     * 第 index 行还原后的文本，词之间以单个空格分隔。
     */
    public String string(int index) {
        StringJoiner joiner = new StringJoiner(" ");
        for (long id : ids(index)) {
            joiner.add(vocabulary.token(Math.toIntExact(id)));
        }
        return joiner.toString();
    }

    public long length(int index) {
        Objects.checkIndex(index, lengths.length);
        return lengths[index];
    }

    public long offset(int index) {
        Objects.checkIndex(index, lengths.length);
        return offsets[index];
    }

    /**
     * id 文件中的元素总数，等于所有行长度之和。
     */
    public long tokenCount() {
        return offsets[lengths.length];
    }

    public IdWidth idWidth() {
        return width;
    }

    public Vocabulary vocabulary() {
        return vocabulary;
    }

    public String outputPath() {
        return outputPath;
    }

    private MappedIdArray mapped() {
        if (ids == null) {
            throw new IllegalStateException("TokenStore 已关闭: " + outputPath);
        }
        return ids;
    }

    /**
     * 释放映射引用，实际解除映射由 GC 完成。
     */
    @Override
    public void close() {
        ids = null;
    }
}
