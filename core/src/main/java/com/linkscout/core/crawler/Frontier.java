package com.linkscout.core.crawler;

import com.linkscout.core.model.FrontierEntry;
import com.linkscout.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO 프론티어 + visited 집합.
 * visited는 "큐에 넣는 순간" 한 번만 기록된다(가져온 시점 아님).
 * offer의 확인-후-추가는 락 안에서 원자적.
 */
public final class Frontier {

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<FrontierEntry> queue = new ArrayDeque<>();
    private final Set<String> visited = new HashSet<>();

    /** 처음 보는 URL이면 visited에 기록하고 큐 뒤에 넣는다 */
    public boolean offer(URI url, int depth) {
        String key = UrlUtils.dedupKey(url);
        lock.lock();
        try {
            if (!visited.add(key)) return false;
            queue.addLast(new FrontierEntry(UrlUtils.normalize(url), depth));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** 리다이렉트 최종 URL처럼 큐에 넣지 않고 방문 처리만 할 때 */
    public boolean markVisited(URI url) {
        String key = UrlUtils.dedupKey(url);
        lock.lock();
        try {
            return visited.add(key);
        } finally {
            lock.unlock();
        }
    }

    public boolean isVisited(URI url) {
        String key = UrlUtils.dedupKey(url);
        lock.lock();
        try {
            return visited.contains(key);
        } finally {
            lock.unlock();
        }
    }

    /** 맨 앞 항목과 같은 깊이의 항목을 모두 꺼낸다(한 BFS 레벨). 비었으면 빈 리스트 */
    public List<FrontierEntry> pollLevel() {
        lock.lock();
        try {
            List<FrontierEntry> level = new ArrayList<>();
            FrontierEntry head = queue.peekFirst();
            if (head == null) return level;
            while (!queue.isEmpty() && queue.peekFirst().depth() == head.depth()) {
                level.add(queue.pollFirst());
            }
            return level;
        } finally {
            lock.unlock();
        }
    }

    public FrontierEntry poll() {
        lock.lock();
        try {
            return queue.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() { return size() == 0; }

    public int visitedCount() {
        lock.lock();
        try {
            return visited.size();
        } finally {
            lock.unlock();
        }
    }
}
