package com.lazytext.recipe;

import com.lazytext.config.Constants;
import com.lazytext.config.CorpusConfig;
import com.lazytext.stream.LengthBounder;
import com.lazytext.stream.LineReader;
import com.lazytext.stream.LineStreams;
import com.lazytext.stream.SentenceResegmenter;
import com.lazytext.storage.TokenStore;
import com.lazytext.text.BlankNormalizer;
import com.lazytext.text.CharLevelSegmenter;
import com.lazytext.text.LineTransform;
import com.lazytext.text.Lowercaser;
import com.lazytext.text.Pipeline;
import com.lazytext.text.Recaser;
import com.lazytext.text.SentenceSegmenter;
import com.lazytext.vocab.IndexedVocabulary;
import com.lazytext.vocab.Vocabulary;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * 单语语料配方：组装预处理流水线，并据此构造词表与存储。
 */
public class MonolingualRecipe {

    private final Pipeline pipeline;

    public MonolingualRecipe(Pipeline pipeline) {
        if (pipeline == null) {
            throw new IllegalArgumentException("pipeline 不能为空");
        }
        this.pipeline = pipeline;
    }

    /**
     * 词级配方：空白归一、小写化、行首恢复大写均可选。
     */
    public static MonolingualRecipe wordLevel(String languageCode, boolean normalizeBlanks,
                                              boolean lowercase, boolean recase) {
        List<LineTransform> steps = new ArrayList<>();
        if (normalizeBlanks) {
            steps.add(new BlankNormalizer());
        }
        if (lowercase) {
            steps.add(new Lowercaser(languageCode));
        }
        if (recase) {
            steps.add(new Recaser());
        }
        return new MonolingualRecipe(new Pipeline(steps));
    }

    /**
     * 字符级配方：在词级步骤之后追加字符切分，post 时先还原词再恢复大写。
     */
    public static MonolingualRecipe charLevel(String languageCode, boolean normalizeBlanks,
                                              boolean lowercase, String separator, boolean recase) {
        List<LineTransform> steps = new ArrayList<>(wordLevel(languageCode, normalizeBlanks, lowercase, recase)
            .pipeline().steps());
        steps.add(new CharLevelSegmenter(separator));
        return new MonolingualRecipe(new Pipeline(steps));
    }

    public static MonolingualRecipe fromConfig(String languageCode, CorpusConfig config) {
        if (config.isCharLevel()) {
            return charLevel(languageCode, config.isNormalizeBlanks(), config.isLowercase(),
                config.getSeparator(), config.isRecase());
        }
        return wordLevel(languageCode, config.isNormalizeBlanks(), config.isLowercase(), config.isRecase());
    }

    public Pipeline pipeline() {
        return pipeline;
    }

    /**
     * 按配置组装处理链，segmenter 为 null 时不重新分句。
     */
    public TextProcessingChain chain(SentenceSegmenter segmenter, CorpusConfig config) {
        SentenceResegmenter resegmenter = segmenter == null
            ? null
            : new SentenceResegmenter(segmenter, config.getReadN());
        return new TextProcessingChain(resegmenter, pipeline, new LengthBounder(config.getMaxLength(), config.isSplit()));
    }

    /**
     * 扫描预处理后的文件构造词表。
     */
    public IndexedVocabulary makeVocabulary(List<Path> files) throws IOException {
        try (LineReader reader = new LineReader(files)) {
            return IndexedVocabulary.fromLines(LineStreams.preprocess(reader, pipeline));
        }
    }

    /**
     * 构建或复用单语存储。
     *
     * split 为 true 时超长行被切成分片分别存储，否则直接丢弃。
     */
    public TokenStore makeCorpus(List<Path> files, Vocabulary vocabulary, CorpusConfig config) throws IOException {
        config.validate();
        try (LineReader reader = new LineReader(files)) {
            return TokenStore.open(tokenized(LineStreams.preprocess(reader, pipeline), config), vocabulary, config);
        }
    }

    static Iterator<List<String>> tokenized(Iterator<String> lines, CorpusConfig config) {
        if (config.isSplit()) {
            LengthBounder bounder = new LengthBounder(config.getMaxLength(), true);
            return LineStreams.tokenize(bounder.pre(lines), Constants.UNBOUNDED);
        }
        return LineStreams.tokenize(lines, config.getMaxLength());
    }
}
