package com.lazytext.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;

/**
 * 语料构建运行时配置
 *
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CorpusConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private String outputPath;
    private boolean reuse = Constants.DEFAULT_REUSE;
    private int idWidth = Constants.DEFAULT_ID_WIDTH;
    private int maxLength = Constants.UNBOUNDED;
    private boolean split;
    private int readN = Constants.DEFAULT_READ_N;
    private boolean normalizeBlanks = true;
    private boolean lowercase;
    private boolean recase;
    private boolean charLevel;
    private String separator = Constants.DEFAULT_SEPARATOR;

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }

    public boolean isReuse() {
        return reuse;
    }

    public void setReuse(boolean reuse) {
        this.reuse = reuse;
    }

    public int getIdWidth() {
        return idWidth;
    }

    public void setIdWidth(int idWidth) {
        this.idWidth = idWidth;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public void setMaxLength(int maxLength) {
        this.maxLength = maxLength;
    }

    public boolean isSplit() {
        return split;
    }

    public void setSplit(boolean split) {
        this.split = split;
    }

    public int getReadN() {
        return readN;
    }

    public void setReadN(int readN) {
        this.readN = readN;
    }

    public boolean isNormalizeBlanks() {
        return normalizeBlanks;
    }

    public void setNormalizeBlanks(boolean normalizeBlanks) {
        this.normalizeBlanks = normalizeBlanks;
    }

    public boolean isLowercase() {
        return lowercase;
    }

    public void setLowercase(boolean lowercase) {
        this.lowercase = lowercase;
    }

    public boolean isRecase() {
        return recase;
    }

    public void setRecase(boolean recase) {
        this.recase = recase;
    }

    public boolean isCharLevel() {
        return charLevel;
    }

    public void setCharLevel(boolean charLevel) {
        this.charLevel = charLevel;
    }

    public String getSeparator() {
        return separator;
    }

    public void setSeparator(String separator) {
        this.separator = separator;
    }

    /**
     * 校验配置组合，非法取值在构造期立即拒绝。
     *
     * @throws IllegalArgumentException 配置无意义时抛出
     */
    public void validate() {
        if (outputPath == null || outputPath.isBlank()) {
            throw new IllegalArgumentException("outputPath 不能为空");
        }
        if (maxLength == 0 || maxLength < Constants.UNBOUNDED) {
            throw new IllegalArgumentException("maxLength 必须为 -1（不限制）或正整数: " + maxLength);
        }
        if (readN == 0 || readN < Constants.UNBOUNDED) {
            throw new IllegalArgumentException("readN 必须为 -1（整体读取）或正整数: " + readN);
        }
        if (idWidth != 2 && idWidth != 4 && idWidth != 8) {
            throw new IllegalArgumentException("idWidth 仅支持 2/4/8 字节: " + idWidth);
        }
        if (separator == null || separator.isBlank()) {
            throw new IllegalArgumentException("separator 不能为空");
        }
    }

    /**
     * 将当前配置写入指定 JSON 文件。
     *
     * @param file 配置文件
     * @throws IOException 写入失败时抛出
     */
    public void writeTo(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, this);
        } catch (IOException exception) {
            throw new IOException("写入配置失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 从指定 JSON 文件读取配置，缺失字段保留默认值。
     *
     * @param file 配置文件
     * @return 反序列化后的配置
     * @throws IOException 读取或解析失败时抛出
     */
    public static CorpusConfig readFrom(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        try {
            return OBJECT_MAPPER.readValue(file, CorpusConfig.class);
        } catch (IOException exception) {
            throw new IOException("读取配置失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 使用默认配置创建实例
     */
    public static CorpusConfig defaults() {
        return new CorpusConfig();
    }
}
