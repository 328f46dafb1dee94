package com.lazytext.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lazytext.config.Constants;
import com.lazytext.config.CorpusConfig;
import com.lazytext.recipe.BilingualRecipe;
import com.lazytext.recipe.MonolingualRecipe;
import com.lazytext.recipe.TextProcessingChain;
import com.lazytext.storage.ParallelTokenStore;
import com.lazytext.storage.TokenStore;
import com.lazytext.stream.LineReader;
import com.lazytext.text.BreakIteratorSentenceSegmenter;
import com.lazytext.vocab.IndexedVocabulary;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "ltc",
    description = "📚 流式文本预处理与内存映射语料构建工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.BuildSubcommand.class,
        MainCommand.BuildParallelSubcommand.class,
        MainCommand.ShowSubcommand.class,
        MainCommand.ProcessSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--config"}, description = "JSON 配置文件，命令行参数优先")
    private Path configFile;

    @Option(names = {"-o", "--output"}, description = "存储文件前缀")
    private String outputPath;

    @Option(names = {"--max-length"}, description = "单行最大词数，-1 表示不限制")
    private Integer maxLength;

    @Option(names = {"--split"}, description = "切分超长行而不是丢弃")
    private Boolean split;

    @Option(names = {"--no-reuse"}, description = "忽略已有存储文件，强制重建")
    private Boolean noReuse;

    @Option(names = {"--id-width"}, description = "id 位宽（字节）：2/4/8")
    private Integer idWidth;

    @Option(names = {"--read-n"}, description = "每批送入分句器的行数，-1 表示整体读取")
    private Integer readN;

    @Option(names = {"--lowercase"}, description = "小写化")
    private Boolean lowercase;

    @Option(names = {"--recase"}, description = "后处理时恢复行首大写")
    private Boolean recase;

    @Option(names = {"--char-level"}, description = "字符级切分")
    private Boolean charLevel;

    @Option(names = {"--separator"}, description = "字符级切分的词边界标记")
    private String separator;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("📚 流式文本预处理与内存映射语料构建工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 读取配置文件（如有）并用显式给出的命令行参数覆盖。
     */
    CorpusConfig resolveConfig() throws IOException {
        CorpusConfig config = configFile == null
            ? CorpusConfig.defaults()
            : CorpusConfig.readFrom(configFile.toFile());
        if (outputPath != null) {
            config.setOutputPath(outputPath);
        }
        if (maxLength != null) {
            config.setMaxLength(maxLength);
        }
        if (split != null) {
            config.setSplit(split);
        }
        if (noReuse != null) {
            config.setReuse(!noReuse);
        }
        if (idWidth != null) {
            config.setIdWidth(idWidth);
        }
        if (readN != null) {
            config.setReadN(readN);
        }
        if (lowercase != null) {
            config.setLowercase(lowercase);
        }
        if (recase != null) {
            config.setRecase(recase);
        }
        if (charLevel != null) {
            config.setCharLevel(charLevel);
        }
        if (separator != null) {
            config.setSeparator(separator);
        }
        return config;
    }

    static Path vocabularyPath(String prefix) {
        return Path.of(prefix + Constants.VOCAB_SUFFIX);
    }

    /**
     * 复用已有词表，或扫描输入重新构造并保存。
     */
    static IndexedVocabulary loadOrMakeVocabulary(MonolingualRecipe recipe, List<Path> files, String prefix,
                                                  boolean reuse) throws IOException {
        File vocabularyFile = vocabularyPath(prefix).toFile();
        if (reuse && vocabularyFile.isFile()) {
            return IndexedVocabulary.readFrom(vocabularyFile);
        }
        IndexedVocabulary vocabulary = recipe.makeVocabulary(files);
        Path parent = vocabularyFile.toPath().toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        vocabulary.writeTo(vocabularyFile);
        return vocabulary;
    }

    static String toJson(Object value) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }

    static void printReport(BuildReport report, String format) throws IOException {
        if ("json".equalsIgnoreCase(format)) {
            System.out.println(toJson(report));
            return;
        }
        System.out.println(report.reused() ? "♻️ 已复用现有存储" : "✅ 存储构建完成！");
        System.out.println("📊 统计:");
        System.out.println("   前缀: " + report.outputPath());
        System.out.println("   流数: " + report.streams());
        System.out.println("   行数: " + report.lines());
        System.out.println("   词数: " + report.tokens());
        System.out.println("   用时: " + report.elapsedMs() + "ms");
    }

    /**
     * 构建结果摘要。
     */
    public record BuildReport(
        String outputPath,
        int streams,
        int lines,
        List<Long> tokens,
        boolean reused,
        long elapsedMs,
        Instant finishedAt
    ) {
    }

    /**
     * show 输出的一行，strings 按流顺序排列。
     */
    public record ShowRow(int index, List<String> strings) {
    }

    @Command(name = "build", description = "🚀 构建单语存储与词表")
    static class BuildSubcommand implements Callable<Integer> {

        @Parameters(description = "输入文本文件（按顺序拼接）", arity = "1..*")
        private List<Path> inputFiles;

        @Option(names = {"--lang"}, description = "语言代码", defaultValue = "en")
        private String languageCode;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                CorpusConfig config = main.resolveConfig();
                config.validate();
                MonolingualRecipe recipe = MonolingualRecipe.fromConfig(languageCode, config);
                long start = System.currentTimeMillis();
                boolean reused = config.isReuse() && TokenStore.artifactsExist(config.getOutputPath());
                IndexedVocabulary vocabulary = loadOrMakeVocabulary(recipe, inputFiles, config.getOutputPath(),
                    config.isReuse());
                try (TokenStore store = recipe.makeCorpus(inputFiles, vocabulary, config)) {
                    long elapsed = System.currentTimeMillis() - start;
                    printReport(new BuildReport(config.getOutputPath(), 1, store.size(),
                        List.of(store.tokenCount()), reused, elapsed, Instant.now()), format);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 构建失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "build-parallel", description = "🔗 构建双语平行存储与两端词表")
    static class BuildParallelSubcommand implements Callable<Integer> {

        @Option(names = {"--src"}, description = "源端输入文件", arity = "1..*", required = true)
        private List<Path> sourceFiles;

        @Option(names = {"--tgt"}, description = "目标端输入文件", arity = "1..*", required = true)
        private List<Path> targetFiles;

        @Option(names = {"--src-lang"}, description = "源端语言代码", defaultValue = "de")
        private String sourceLanguage;

        @Option(names = {"--tgt-lang"}, description = "目标端语言代码", defaultValue = "en")
        private String targetLanguage;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                CorpusConfig config = main.resolveConfig();
                config.validate();
                BilingualRecipe recipe = new BilingualRecipe(
                    MonolingualRecipe.fromConfig(sourceLanguage, config),
                    MonolingualRecipe.fromConfig(targetLanguage, config));
                String prefix = config.getOutputPath();
                long start = System.currentTimeMillis();
                boolean reused = config.isReuse()
                    && TokenStore.artifactsExist(ParallelTokenStore.streamPath(prefix, 0))
                    && TokenStore.artifactsExist(ParallelTokenStore.streamPath(prefix, 1));
                IndexedVocabulary sourceVocabulary = loadOrMakeVocabulary(recipe.source(), sourceFiles,
                    ParallelTokenStore.streamPath(prefix, 0), config.isReuse());
                IndexedVocabulary targetVocabulary = loadOrMakeVocabulary(recipe.target(), targetFiles,
                    ParallelTokenStore.streamPath(prefix, 1), config.isReuse());
                try (ParallelTokenStore store = recipe.makeCorpus(sourceFiles, targetFiles,
                    sourceVocabulary, targetVocabulary, config)) {
                    long elapsed = System.currentTimeMillis() - start;
                    List<Long> tokens = List.of(store.store(0).tokenCount(), store.store(1).tokenCount());
                    printReport(new BuildReport(prefix, store.streamCount(), store.size(), tokens, reused,
                        elapsed, Instant.now()), format);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 构建失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "show", description = "🔎 按行输出已有存储的内容")
    static class ShowSubcommand implements Callable<Integer> {

        @Option(names = {"--streams"}, description = "流数，1 表示单语存储", defaultValue = "1")
        private int streams;

        @Option(names = {"--start"}, description = "起始行号（从 0 开始）", defaultValue = "0")
        private int start;

        @Option(names = {"-l", "--limit"}, description = "输出行数", defaultValue = "10")
        private int limit;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                CorpusConfig config = main.resolveConfig();
                String prefix = config.getOutputPath();
                if (prefix == null || prefix.isBlank()) {
                    System.err.println("❌ 请通过 --output 指定存储前缀");
                    return 1;
                }
                int safeLimit = sanitizeLimit(limit);
                List<ShowRow> rows = readRows(prefix, Math.max(0, start), safeLimit);
                if ("json".equalsIgnoreCase(format)) {
                    System.out.println(toJson(rows));
                    return 0;
                }
                for (ShowRow row : rows) {
                    System.out.println(row.index() + " ||| " + String.join(" ||| ", row.strings()));
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 读取失败: " + exception.getMessage());
                return 1;
            }
        }

        private List<ShowRow> readRows(String prefix, int from, int count) throws IOException {
            List<ShowRow> rows = new ArrayList<>();
            if (streams <= 1) {
                try (TokenStore store = TokenStore.load(prefix,
                    IndexedVocabulary.readFrom(vocabularyPath(prefix).toFile()))) {
                    for (int index = from; index < Math.min(store.size(), from + count); index++) {
                        rows.add(new ShowRow(index, List.of(store.string(index))));
                    }
                }
                return rows;
            }
            List<IndexedVocabulary> vocabularies = new ArrayList<>(streams);
            for (int streamIndex = 0; streamIndex < streams; streamIndex++) {
                vocabularies.add(IndexedVocabulary.readFrom(
                    vocabularyPath(ParallelTokenStore.streamPath(prefix, streamIndex)).toFile()));
            }
            try (ParallelTokenStore store = ParallelTokenStore.load(prefix, vocabularies)) {
                for (int index = from; index < Math.min(store.size(), from + count); index++) {
                    rows.add(new ShowRow(index, store.strings(index)));
                }
            }
            return rows;
        }

        private int sanitizeLimit(int rawLimit) {
            if (rawLimit < 0) {
                System.err.printf("⚠️ limit=%d 非法，已使用 0%n", rawLimit);
                return 0;
            }
            if (rawLimit > Constants.MAX_SHOW_LIMIT) {
                System.err.printf("⚠️ limit=%d 超过上限 %d，已自动限制%n", rawLimit, Constants.MAX_SHOW_LIMIT);
                return Constants.MAX_SHOW_LIMIT;
            }
            return rawLimit;
        }
    }

    @Command(name = "process", description = "🔄 对输入执行预处理流水线并输出结果")
    static class ProcessSubcommand implements Callable<Integer> {

        @Parameters(description = "输入文本文件（按顺序拼接）", arity = "1..*")
        private List<Path> inputFiles;

        @Option(names = {"--lang"}, description = "语言代码", defaultValue = "en")
        private String languageCode;

        @Option(names = {"--sentence-split"}, description = "先按句子重新切分输入", defaultValue = "false")
        private boolean sentenceSplit;

        @Option(names = {"--round-trip"}, description = "预处理后立即还原（join + post）", defaultValue = "false")
        private boolean roundTrip;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                CorpusConfig config = main.resolveConfig();
                for (Path inputFile : inputFiles) {
                    if (!Files.isRegularFile(inputFile)) {
                        System.err.println("❌ 输入文件不存在: " + inputFile);
                        return 1;
                    }
                }
                TextProcessingChain chain = MonolingualRecipe.fromConfig(languageCode, config)
                    .chain(sentenceSplit ? new BreakIteratorSentenceSegmenter(languageCode) : null, config);
                try (LineReader reader = new LineReader(inputFiles)) {
                    Iterator<String> output = roundTrip ? chain.roundTrip(reader) : chain.preprocess(reader);
                    while (output.hasNext()) {
                        System.out.println(output.next());
                    }
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 处理失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }
}
