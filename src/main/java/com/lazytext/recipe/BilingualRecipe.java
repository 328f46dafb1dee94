package com.lazytext.recipe;

import com.lazytext.config.CorpusConfig;
import com.lazytext.stream.LineReader;
import com.lazytext.stream.LineStreams;
import com.lazytext.storage.ParallelTokenStore;
import com.lazytext.vocab.IndexedVocabulary;
import com.lazytext.vocab.Vocabulary;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 双语平行语料配方，源端与目标端各自一条预处理流水线。
 *
 * 超长元组整组丢弃以保持行对齐；平行语料不支持分片切分。
 */
public class BilingualRecipe {

    private final MonolingualRecipe source;
    private final MonolingualRecipe target;

    public BilingualRecipe(MonolingualRecipe source, MonolingualRecipe target) {
        if (source == null || target == null) {
            throw new IllegalArgumentException("源端与目标端配方不能为空");
        }
        this.source = source;
        this.target = target;
    }

    public static BilingualRecipe wordLevel(String sourceCode, String targetCode, boolean normalizeBlanks,
                                            boolean lowercase, boolean recase) {
        return new BilingualRecipe(
            MonolingualRecipe.wordLevel(sourceCode, normalizeBlanks, lowercase, recase),
            MonolingualRecipe.wordLevel(targetCode, normalizeBlanks, lowercase, recase));
    }

    public MonolingualRecipe source() {
        return source;
    }

    public MonolingualRecipe target() {
        return target;
    }

    public IndexedVocabulary makeSourceVocabulary(List<Path> files) throws IOException {
        return source.makeVocabulary(files);
    }

    public IndexedVocabulary makeTargetVocabulary(List<Path> files) throws IOException {
        return target.makeVocabulary(files);
    }

    /**
     * 构建或复用双流平行存储，流 0 为源端，流 1 为目标端。
     *
     * @throws IllegalArgumentException 配置要求切分超长行时抛出
     */
    public ParallelTokenStore makeCorpus(List<Path> sourceFiles, List<Path> targetFiles,
                                         Vocabulary sourceVocabulary, Vocabulary targetVocabulary,
                                         CorpusConfig config) throws IOException {
        config.validate();
        if (config.isSplit()) {
            throw new IllegalArgumentException("平行语料不支持 split，超长元组只能丢弃");
        }
        try (LineReader sourceReader = new LineReader(sourceFiles);
             LineReader targetReader = new LineReader(targetFiles)) {
            return ParallelTokenStore.open(
                LineStreams.zipTokenized(List.of(
                    LineStreams.preprocess(sourceReader, source.pipeline()),
                    LineStreams.preprocess(targetReader, target.pipeline())), config.getMaxLength()),
                List.of(sourceVocabulary, targetVocabulary),
                config);
        }
    }
}
