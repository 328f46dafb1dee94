package com.lazytext.stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StreamFanoutTest {

    @Test
    @DisplayName("每个视图都完整看到上游的每个元素，且上游只被读取一次")
    void testEveryViewSeesEveryItemOnce() {
        AtomicInteger pulls = new AtomicInteger();
        Iterator<Integer> source = LineStreams.map(List.of(1, 2, 3, 4).iterator(), value -> {
            pulls.incrementAndGet();
            return value;
        });
        StreamFanout<Integer> fanout = new StreamFanout<>(source, 3);

        List<Integer> first = drain(fanout.view(0));
        List<Integer> second = drain(fanout.view(1));
        List<Integer> third = drain(fanout.view(2));

        assertEquals(List.of(1, 2, 3, 4), first);
        assertEquals(first, second);
        assertEquals(first, third);
        assertEquals(4, pulls.get());
    }

    @Test
    @DisplayName("只缓存各视图未读的尾部")
    void testBuffersOnlyUnreadTail() {
        StreamFanout<String> fanout = new StreamFanout<>(List.of("a", "b", "c").iterator(), 2);

        fanout.view(0).next();
        fanout.view(0).next();
        assertEquals(0, fanout.buffered(0));
        assertEquals(2, fanout.buffered(1));

        assertEquals("a", fanout.view(1).next());
        assertEquals(1, fanout.buffered(1));
    }

    @Test
    @DisplayName("步调一致时缓冲不超过一个元素")
    void testLockstepKeepsBufferSmall() {
        StreamFanout<String> fanout = new StreamFanout<>(List.of("a", "b", "c").iterator(), 2);

        while (fanout.view(0).hasNext()) {
            assertEquals(fanout.view(0).next(), fanout.view(1).next());
            assertEquals(0, fanout.buffered(0));
            assertEquals(0, fanout.buffered(1));
        }
        assertFalse(fanout.view(1).hasNext());
    }

    @Test
    void testRejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new StreamFanout<>(List.of().iterator(), 0));
        assertThrows(IllegalArgumentException.class, () -> new StreamFanout<String>(null, 1));
    }

    private static <T> List<T> drain(Iterator<T> iterator) {
        List<T> items = new ArrayList<>();
        iterator.forEachRemaining(items::add);
        return items;
    }
}
