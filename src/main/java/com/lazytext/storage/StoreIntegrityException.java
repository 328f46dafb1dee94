package com.lazytext.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 存储文件与长度索引不一致，或文件头损坏。
 */
public class StoreIntegrityException extends IOException {
    private final Path path;
    private final long expected;
    private final long observed;

    public StoreIntegrityException(String message, Path path, long expected, long observed) {
        super(message + ": " + path + ", expected=" + expected + ", observed=" + observed);
        this.path = path;
        this.expected = expected;
        this.observed = observed;
    }

    public Path getPath() {
        return path;
    }

    public long getExpected() {
        return expected;
    }

    public long getObserved() {
        return observed;
    }
}
