package com.lazytext.storage;

import com.lazytext.config.CorpusConfig;
import com.lazytext.stream.LineStreams;
import com.lazytext.stream.StreamFanout;
import com.lazytext.vocab.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * N 个按行对齐的存储（如翻译语料的源端与目标端）。
 *
 * 第 k 个流使用 {@code <outputPath><k>} 作为自己的前缀；任意下标 i 在每个流中都对应输入的第 i 个元组。
 * 各流每行的词数互不相关。
 */
public final class ParallelTokenStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ParallelTokenStore.class);

    private final List<TokenStore> stores;

    private ParallelTokenStore(List<TokenStore> stores) {
        this.stores = Collections.unmodifiableList(stores);
    }

    public static String streamPath(String outputPath, int streamIndex) {
        return outputPath + streamIndex;
    }

    /**
     * 构建或复用 N 个对齐存储。
     *
     * 只有 reuse 为 true 且全部 2N 个文件都存在时才复用；否则单遍消费元组流，
     * 各流视图步调一致地写入，缓冲不超过一个元组。
     *
     * @param tuples 每个元素是 N 个词列表组成的元组
     * @param vocabularies 每个流一个词表，数量即 N
     * @throws IllegalArgumentException 元组宽度与流数不一致
     * @throws StoreIntegrityException 复用的各流行数不一致
     */
    public static ParallelTokenStore build(Iterator<List<List<String>>> tuples, List<? extends Vocabulary> vocabularies,
                                           String outputPath, IdWidth width, boolean reuse) throws IOException {
        Objects.requireNonNull(tuples, "tuples 不能为空");
        if (vocabularies == null || vocabularies.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个词表");
        }
        int streamCount = vocabularies.size();
        if (reuse && allArtifactsExist(outputPath, streamCount)) {
            List<TokenStore> stores = new ArrayList<>(streamCount);
            for (int streamIndex = 0; streamIndex < streamCount; streamIndex++) {
                TokenStore store = TokenStore.load(streamPath(outputPath, streamIndex), vocabularies.get(streamIndex));
                if (store.idWidth() != width) {
                    logger.warn("复用的存储位宽为 {}，与请求的 {} 不同: {}", store.idWidth(), width, store.outputPath());
                }
                stores.add(store);
            }
            return new ParallelTokenStore(requireAligned(stores));
        }

        logger.info("开始构建平行存储: {} (streams={})", outputPath, streamCount);
        StreamFanout<List<List<String>>> fanout = new StreamFanout<>(tuples, streamCount);
        List<Iterator<List<String>>> columns = new ArrayList<>(streamCount);
        for (int streamIndex = 0; streamIndex < streamCount; streamIndex++) {
            int column = streamIndex;
            columns.add(LineStreams.map(fanout.view(streamIndex), tuple -> columnOf(tuple, column, streamCount)));
        }

        try (WriterGroup writers = new WriterGroup(streamCount)) {
            for (int streamIndex = 0; streamIndex < streamCount; streamIndex++) {
                writers.add(new TokenStoreWriter(streamPath(outputPath, streamIndex),
                    vocabularies.get(streamIndex), width));
            }
            while (columns.get(0).hasNext()) {
                for (int streamIndex = 0; streamIndex < streamCount; streamIndex++) {
                    writers.get(streamIndex).append(columns.get(streamIndex).next());
                }
            }
            for (int streamIndex = 0; streamIndex < streamCount; streamIndex++) {
                writers.get(streamIndex).finish();
            }
            logger.info("平行存储构建完成: {} (lines={})", outputPath, writers.get(0).lineCount());
        }

        List<TokenStore> stores = new ArrayList<>(streamCount);
        for (int streamIndex = 0; streamIndex < streamCount; streamIndex++) {
            stores.add(TokenStore.load(streamPath(outputPath, streamIndex), vocabularies.get(streamIndex)));
        }
        return new ParallelTokenStore(requireAligned(stores));
    }

    /**
     * 按配置中的 outputPath、idWidth 与 reuse 构建或复用。
     */
    public static ParallelTokenStore open(Iterator<List<List<String>>> tuples, List<? extends Vocabulary> vocabularies,
                                          CorpusConfig config) throws IOException {
        config.validate();
        return build(tuples, vocabularies, config.getOutputPath(),
            IdWidth.ofBytes(config.getIdWidth()), config.isReuse());
    }

    /**
     * 加载已有的 N 个对齐存储。
     */
    public static ParallelTokenStore load(String outputPath, List<? extends Vocabulary> vocabularies) throws IOException {
        if (vocabularies == null || vocabularies.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个词表");
        }
        List<TokenStore> stores = new ArrayList<>(vocabularies.size());
        for (int streamIndex = 0; streamIndex < vocabularies.size(); streamIndex++) {
            stores.add(TokenStore.load(streamPath(outputPath, streamIndex), vocabularies.get(streamIndex)));
        }
        return new ParallelTokenStore(requireAligned(stores));
    }

    private static boolean allArtifactsExist(String outputPath, int streamCount) {
        int present = 0;
        for (int streamIndex = 0; streamIndex < streamCount; streamIndex++) {
            if (TokenStore.artifactsExist(streamPath(outputPath, streamIndex))) {
                present++;
            }
        }
        if (present > 0 && present < streamCount) {
            logger.info("平行存储只有 {}/{} 个流可复用，全部重建: {}", present, streamCount, outputPath);
        }
        return present == streamCount;
    }

    private static List<String> columnOf(List<List<String>> tuple, int column, int streamCount) {
        if (tuple.size() != streamCount) {
            throw new IllegalArgumentException("元组宽度与流数不一致: expected=" + streamCount + ", actual=" + tuple.size());
        }
        return tuple.get(column);
    }

    private static List<TokenStore> requireAligned(List<TokenStore> stores) throws StoreIntegrityException {
        int expected = stores.get(0).size();
        for (TokenStore store : stores) {
            if (store.size() != expected) {
                throw new StoreIntegrityException("平行存储各流行数不一致",
                    TokenStore.lengthsPath(store.outputPath()), expected, store.size());
            }
        }
        return stores;
    }

    /**
     * 行数，所有流相同。
     */
    public int size() {
        return stores.get(0).size();
    }

    public int streamCount() {
        return stores.size();
    }

    public TokenStore store(int streamIndex) {
        return stores.get(streamIndex);
    }

    /**
     * 第 index 个元组在各流中的 id 序列。
     */
    public List<long[]> ids(int index) {
        List<long[]> tuple = new ArrayList<>(stores.size());
        for (TokenStore store : stores) {
            tuple.add(store.ids(index));
        }
        return tuple;
    }

    /**
     * 第 index 个元组在各流中的文本。
     */
    public List<String> strings(int index) {
        List<String> tuple = new ArrayList<>(stores.size());
        for (TokenStore store : stores) {
            tuple.add(store.string(index));
        }
        return List.copyOf(tuple);
    }

    public List<Path> artifactPaths() {
        List<Path> paths = new ArrayList<>(stores.size() * 2);
        for (TokenStore store : stores) {
            paths.add(TokenStore.lengthsPath(store.outputPath()));
            paths.add(TokenStore.memmapPath(store.outputPath()));
        }
        return paths;
    }

    @Override
    public void close() {
        stores.forEach(TokenStore::close);
    }

    /**
     * 统一关闭多个写入器，首个异常之外的异常作为 suppressed 附加。
     */
    private static final class WriterGroup implements AutoCloseable {
        private final List<TokenStoreWriter> writers;

        private WriterGroup(int capacity) {
            this.writers = new ArrayList<>(capacity);
        }

        private void add(TokenStoreWriter writer) {
            writers.add(writer);
        }

        private TokenStoreWriter get(int index) {
            return writers.get(index);
        }

        @Override
        public void close() throws IOException {
            IOException failure = null;
            for (TokenStoreWriter writer : writers) {
                try {
                    writer.close();
                } catch (IOException exception) {
                    if (failure == null) {
                        failure = exception;
                    } else {
                        failure.addSuppressed(exception);
                    }
                }
            }
            if (failure != null) {
                throw failure;
            }
        }
    }
}
