package com.lazytext.vocab;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lazytext.config.Constants;
import com.lazytext.stream.LineStreams;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 基于列表的词表实现，id 即词在列表中的下标。
 *
 * 前四个 id 固定为 {@code <unk> <pad> <s> </s>}，其余词按首次出现顺序编号。
 */
public final class IndexedVocabulary implements Vocabulary {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final List<String> RESERVED_TOKENS = List.of(
        Constants.UNK_TOKEN, Constants.PAD_TOKEN, Constants.SOS_TOKEN, Constants.EOS_TOKEN);

    private final List<String> tokens;
    private final Map<String, Integer> idsByToken;

    @JsonCreator
    public IndexedVocabulary(@JsonProperty("tokens") List<String> tokens) {
        if (tokens == null || tokens.size() < RESERVED_TOKENS.size()
            || !tokens.subList(0, RESERVED_TOKENS.size()).equals(RESERVED_TOKENS)) {
            throw new IllegalArgumentException("词表必须以保留词开头: " + RESERVED_TOKENS);
        }
        this.tokens = List.copyOf(tokens);
        this.idsByToken = new HashMap<>(tokens.size() * 2);
        for (int id = 0; id < this.tokens.size(); id++) {
            Integer previous = idsByToken.putIfAbsent(this.tokens.get(id), id);
            if (previous != null) {
                throw new IllegalArgumentException("词表存在重复词: " + this.tokens.get(id));
            }
        }
    }

    /**
     * 扫描行流（按空白分词）构造词表。
     */
    public static IndexedVocabulary fromLines(Iterator<String> lines) {
        Objects.requireNonNull(lines, "lines 不能为空");
        List<String> collected = new ArrayList<>(RESERVED_TOKENS);
        Map<String, Boolean> seen = new HashMap<>();
        RESERVED_TOKENS.forEach(token -> seen.put(token, Boolean.TRUE));
        while (lines.hasNext()) {
            for (String token : LineStreams.whitespaceTokens(lines.next())) {
                if (seen.putIfAbsent(token, Boolean.TRUE) == null) {
                    collected.add(token);
                }
            }
        }
        return new IndexedVocabulary(collected);
    }

    @Override
    public int id(String token) {
        return idsByToken.getOrDefault(token, unknownId());
    }

    @Override
    public String token(int id) {
        return tokens.get(id);
    }

    @Override
    public int unknownId() {
        return 0;
    }

    @Override
    public int size() {
        return tokens.size();
    }

    @JsonProperty("tokens")
    public List<String> tokens() {
        return tokens;
    }

    /**
     * 将词表写入 JSON 文件。
     *
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("词表文件不能为空");
        }
        try {
            OBJECT_MAPPER.writeValue(file, this);
        } catch (IOException exception) {
            throw new IOException("写入词表失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 从 JSON 文件读取词表。
     *
     * @throws IOException 读取或解析失败时抛出
     */
    public static IndexedVocabulary readFrom(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("词表文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file, IndexedVocabulary.class);
        } catch (IOException exception) {
            throw new IOException("读取词表失败: " + file.getAbsolutePath(), exception);
        }
    }
}
