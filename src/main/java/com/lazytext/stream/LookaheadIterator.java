package com.lazytext.stream;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 预取一个元素的迭代器骨架，子类只需实现 {@link #computeNext()}。
 *
 * @param <T> 元素类型
 */
abstract class LookaheadIterator<T> implements Iterator<T> {

    private T nextItem;
    private boolean ready;
    private boolean finished;

    /**
     * 计算下一个元素，无更多元素时调用 {@link #endOfData()} 并返回其结果。
     */
    protected abstract T computeNext();

    protected final T endOfData() {
        finished = true;
        return null;
    }

    @Override
    public final boolean hasNext() {
        if (ready) {
            return true;
        }
        if (finished) {
            return false;
        }
        T candidate = computeNext();
        if (finished) {
            return false;
        }
        nextItem = candidate;
        ready = true;
        return true;
    }

    @Override
    public final T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        T item = nextItem;
        nextItem = null;
        ready = false;
        return item;
    }
}
