package com.lazytext.stream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 将一个只能消费一次的上游迭代器广播为多个独立游标。
 *
 * 每个视图只缓存自己尚未读取的尾部，因此各视图步调越接近，内存占用越小。
 * 非线程安全。
 *
 * @param <T> 元素类型
 */
public final class StreamFanout<T> {

    private final Iterator<? extends T> source;
    private final List<ArrayDeque<T>> pendingByView;
    private final List<Iterator<T>> views;

    public StreamFanout(Iterator<? extends T> source, int viewCount) {
        if (source == null) {
            throw new IllegalArgumentException("上游迭代器不能为空");
        }
        if (viewCount <= 0) {
            throw new IllegalArgumentException("视图数量必须为正: " + viewCount);
        }
        this.source = source;
        this.pendingByView = new ArrayList<>(viewCount);
        List<Iterator<T>> createdViews = new ArrayList<>(viewCount);
        for (int viewIndex = 0; viewIndex < viewCount; viewIndex++) {
            pendingByView.add(new ArrayDeque<>());
            createdViews.add(new View(viewIndex));
        }
        this.views = Collections.unmodifiableList(createdViews);
    }

    public Iterator<T> view(int viewIndex) {
        return views.get(viewIndex);
    }

    public List<Iterator<T>> views() {
        return views;
    }

    public int viewCount() {
        return views.size();
    }

    /**
     * 返回指定视图当前缓存的元素个数。
     */
    public int buffered(int viewIndex) {
        return pendingByView.get(viewIndex).size();
    }

    private boolean pull() {
        if (!source.hasNext()) {
            return false;
        }
        T item = source.next();
        for (ArrayDeque<T> pending : pendingByView) {
            pending.addLast(item);
        }
        return true;
    }

    private final class View implements Iterator<T> {
        private final ArrayDeque<T> pending;

        private View(int viewIndex) {
            this.pending = pendingByView.get(viewIndex);
        }

        @Override
        public boolean hasNext() {
            return !pending.isEmpty() || pull();
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.removeFirst();
        }
    }
}
