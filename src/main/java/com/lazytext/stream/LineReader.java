package com.lazytext.stream;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 按顺序惰性读取一个或多个文本文件的所有行。
 *
 * 读完一个文件后立即关闭其句柄；提前放弃迭代时需调用 {@link #close()}。
 */
public final class LineReader extends LookaheadIterator<String> implements AutoCloseable {

    private final List<Path> files;
    private int fileIndex;
    private BufferedReader currentReader;

    public LineReader(List<Path> files) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("输入文件列表不能为空");
        }
        this.files = List.copyOf(files);
    }

    @Override
    protected String computeNext() {
        try {
            while (true) {
                if (currentReader == null) {
                    if (fileIndex >= files.size()) {
                        return endOfData();
                    }
                    currentReader = Files.newBufferedReader(files.get(fileIndex++), StandardCharsets.UTF_8);
                }
                String line = currentReader.readLine();
                if (line != null) {
                    return line;
                }
                currentReader.close();
                currentReader = null;
            }
        } catch (IOException exception) {
            Path failedFile = files.get(Math.max(0, fileIndex - 1));
            throw new UncheckedIOException("读取输入文件失败: " + failedFile, exception);
        }
    }

    @Override
    public void close() throws IOException {
        if (currentReader != null) {
            currentReader.close();
            currentReader = null;
        }
        fileIndex = files.size();
    }
}
