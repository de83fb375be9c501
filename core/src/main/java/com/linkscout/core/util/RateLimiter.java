package com.linkscout.core.util;

/**
 * 토큰 버킷. 링크 검증 요청의 초당 상한에 사용.
 * capacity = 순간 허용량(버스트), refillPerSecond = 초당 보충량.
 */
public final class RateLimiter {
    private final long capacity;
    private final double refillPerSecond;
    private double tokens;
    private long lastNs;

    public RateLimiter(long capacity, double refillPerSecond) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        if (refillPerSecond <= 0) throw new IllegalArgumentException("refillPerSecond must be > 0");
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.tokens = capacity;
        this.lastNs = System.nanoTime();
    }

    /** 버스트 1, 초당 rps개 */
    public static RateLimiter perSecond(int rps) {
        return new RateLimiter(1, Math.max(1, rps));
    }

    public synchronized void acquire() throws InterruptedException {
        for (;;) {
            refill();
            if (tokens >= 1.0) { tokens -= 1.0; return; }
            // 다음 토큰까지 남은 시간만큼만 대기(최소 1ms)
            long waitMs = (long) Math.ceil((1.0 - tokens) / refillPerSecond * 1000.0);
            this.wait(Math.max(1, waitMs));
        }
    }

    /** 대기 없이 토큰이 있으면 소비 */
    public synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1.0) { tokens -= 1.0; return true; }
        return false;
    }

    private void refill() {
        long now = System.nanoTime();
        double add = (now - lastNs) / 1_000_000_000.0 * refillPerSecond;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}
