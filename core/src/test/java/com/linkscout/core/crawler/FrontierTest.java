package com.linkscout.core.crawler;

import com.linkscout.core.model.FrontierEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FrontierTest {

    @Test
    @DisplayName("정규화 기준으로 한 번만 큐에 들어간다")
    void offer_dedupsByNormalizedKey() {
        Frontier f = new Frontier();
        assertTrue(f.offer(URI.create("https://ex.com/a"), 1));
        assertFalse(f.offer(URI.create("https://EX.com:443/a/"), 1));
        assertFalse(f.offer(URI.create("https://ex.com/a#frag"), 2));
        assertTrue(f.offer(URI.create("https://ex.com/a?x=1"), 1));
        assertEquals(2, f.size());
        assertEquals(2, f.visitedCount());
    }

    @Test
    @DisplayName("pollLevel은 맨 앞 깊이의 항목만 FIFO로")
    void pollLevel_returnsOneDepth() {
        Frontier f = new Frontier();
        f.offer(URI.create("https://ex.com/"), 0);
        f.offer(URI.create("https://ex.com/b"), 1);
        f.offer(URI.create("https://ex.com/c"), 1);
        f.offer(URI.create("https://ex.com/d"), 2);

        assertEquals(1, f.pollLevel().size());
        List<FrontierEntry> l1 = f.pollLevel();
        assertEquals(List.of(URI.create("https://ex.com/b"), URI.create("https://ex.com/c")),
                l1.stream().map(FrontierEntry::url).toList());
        assertEquals(2, f.poll().depth());
        assertTrue(f.isEmpty());
        assertTrue(f.pollLevel().isEmpty());
        assertNull(f.poll());
    }

    @Test
    void markVisited_blocksLaterOffer() {
        Frontier f = new Frontier();
        assertTrue(f.markVisited(URI.create("https://ex.com/final")));
        assertTrue(f.isVisited(URI.create("https://ex.com/final/")));
        assertFalse(f.offer(URI.create("https://ex.com/final"), 1));
        assertTrue(f.isEmpty());
    }

    @Test
    @DisplayName("동시 offer에서도 URL당 정확히 한 번")
    void concurrentOffers_acceptEachOnce() throws Exception {
        Frontier f = new Frontier();
        int threads = 8, urls = 200;
        AtomicInteger accepted = new AtomicInteger();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < urls; i++) {
                        if (f.offer(URI.create("https://ex.com/p" + i), 1)) accepted.incrementAndGet();
                    }
                    return null;
                });
            }
            go.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        }
        assertEquals(urls, accepted.get());
        assertEquals(urls, f.size());
    }
}
