package com.docsum.llm.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Token Bucket Rate Limiter
 *
 * HOW IT WORKS:
 * ============
 * The bucket holds up to CAPACITY tokens and refills continuously at
 * requestsPerMinute / 60 tokens per second. Each request consumes one token.
 *
 * {@link #acquire()} reserves a token while holding the lock: the balance is allowed to go
 * negative, and the caller sleeps (outside the lock) until its token has been refilled.
 * Because reservations are taken under a fair lock, callers are granted in arrival order,
 * and a token is never handed to two callers.
 *
 * An interrupted waiter returns its token only if no later reservation exists. Later
 * waiters already hold release times computed past its slot, so refunding then would let
 * a newcomer share a slot with the last of them.
 *
 * Example with RATE_LIMIT_RPM=5, capacity 1:
 * - The first request goes out immediately
 * - Five callers arriving together are then released 12s apart
 * - Over any window of T seconds at most 1 + T/12 requests are granted
 */
@Slf4j
public class TokenBucketRateLimiter implements RateLimiter {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final String name;
    private final double capacity;
    private final double refillRatePerSecond;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock(true);

    // Guarded by lock. Negative while callers are queued for future tokens.
    private double storedTokens;
    private long lastRefillNanos;
    private long lastTicket;

    /**
     * @param name              identifier used in logs
     * @param requestsPerMinute sustained request budget
     * @param burstCapacity     maximum tokens held while idle
     */
    public TokenBucketRateLimiter(String name, double requestsPerMinute, double burstCapacity) {
        this(name, requestsPerMinute, burstCapacity, System::nanoTime, TimeUnit.NANOSECONDS::sleep);
    }

    TokenBucketRateLimiter(String name, double requestsPerMinute, double burstCapacity,
                           LongSupplier nanoClock, Sleeper sleeper) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive: " + requestsPerMinute);
        }
        if (burstCapacity < 1) {
            throw new IllegalArgumentException("burstCapacity must be at least 1: " + burstCapacity);
        }
        this.name = name;
        this.capacity = burstCapacity;
        this.refillRatePerSecond = requestsPerMinute / 60.0;
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
        this.storedTokens = burstCapacity;
        this.lastRefillNanos = nanoClock.getAsLong();

        log.info("[RATE_LIMIT] Token bucket created | name={} | capacity={} | refillRatePerSec={}",
            name, burstCapacity, String.format("%.4f", refillRatePerSecond));
    }

    @Override
    public void acquire() throws InterruptedException {
        Reservation reservation = reserve();
        if (reservation.waitNanos <= 0) {
            return;
        }

        log.debug("[RATE_LIMIT] Waiting for token | name={} | waitMs={}", name, reservation.waitNanos / 1_000_000);
        try {
            sleeper.sleep(reservation.waitNanos);
        } catch (InterruptedException e) {
            refund(reservation.ticket);
            throw e;
        }
    }

    @Override
    public boolean tryAcquire() {
        lock.lock();
        try {
            refill(nanoClock.getAsLong());
            if (storedTokens >= 1.0) {
                storedTokens -= 1.0;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public double getAvailableTokens() {
        lock.lock();
        try {
            refill(nanoClock.getAsLong());
            return Math.max(0.0, storedTokens);
        } finally {
            lock.unlock();
        }
    }

    public double getCapacity() {
        return capacity;
    }

    public double getRefillRatePerSecond() {
        return refillRatePerSecond;
    }

    public String getName() {
        return name;
    }

    /**
     * Takes one token, possibly on credit, and returns how long the caller must wait for it.
     */
    private Reservation reserve() {
        lock.lock();
        try {
            refill(nanoClock.getAsLong());
            storedTokens -= 1.0;
            long ticket = ++lastTicket;
            if (storedTokens >= 0) {
                return new Reservation(ticket, 0);
            }
            return new Reservation(ticket,
                (long) Math.ceil(-storedTokens / refillRatePerSecond * NANOS_PER_SECOND));
        } finally {
            lock.unlock();
        }
    }

    private void refund(long ticket) {
        lock.lock();
        try {
            if (ticket != lastTicket) {
                log.debug("[RATE_LIMIT] Reservation abandoned, later waiters keep their slots | name={}", name);
                return;
            }
            refill(nanoClock.getAsLong());
            storedTokens = Math.min(capacity, storedTokens + 1.0);
            log.debug("[RATE_LIMIT] Reservation abandoned, token returned | name={}", name);
        } finally {
            lock.unlock();
        }
    }

    private void refill(long now) {
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        double tokensToAdd = elapsed / NANOS_PER_SECOND * refillRatePerSecond;
        storedTokens = Math.min(capacity, storedTokens + tokensToAdd);
        lastRefillNanos = now;
    }

    @Override
    public String toString() {
        return String.format("TokenBucketRateLimiter[%s: %.2f/%.0f tokens]",
            name, getAvailableTokens(), capacity);
    }

    private static final class Reservation {
        final long ticket;
        final long waitNanos;

        Reservation(long ticket, long waitNanos) {
            this.ticket = ticket;
            this.waitNanos = waitNanos;
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long nanos) throws InterruptedException;
    }
}
