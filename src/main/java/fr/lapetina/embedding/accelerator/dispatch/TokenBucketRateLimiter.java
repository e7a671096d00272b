package fr.lapetina.embedding.accelerator.dispatch;

import fr.lapetina.embedding.accelerator.domain.exception.ConfigurationException;
import fr.lapetina.embedding.accelerator.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket admission control for backend calls.
 *
 * The bucket starts full with {@code burstSize} tokens and refills
 * continuously at {@code ratePerSecond}. Callers never fail or get dropped;
 * they wait. Waiters are served in arrival order: the fair lock queues them
 * and the head of the queue sleeps for its computed wait while holding it.
 *
 * Over any window of length T starting from a full bucket, at most
 * {@code burstSize + rate * T} tokens are handed out.
 */
public final class TokenBucketRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private static final long NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final double ratePerSecond;
    private final int burstSize;
    private final MetricsRegistry metrics;
    private final ReentrantLock lock = new ReentrantLock(true);

    // guarded by lock
    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(double ratePerSecond, int burstSize, MetricsRegistry metrics) {
        this.ratePerSecond = ConfigurationException.requirePositive("rateLimit.requestsPerSecond", ratePerSecond);
        this.burstSize = ConfigurationException.requirePositive("rateLimit.burstSize", burstSize);
        this.metrics = metrics;
        this.tokens = burstSize;
        this.lastRefillNanos = System.nanoTime();
        log.info("TokenBucketRateLimiter initialized: ratePerSecond={}, burstSize={}", ratePerSecond, burstSize);
    }

    public TokenBucketRateLimiter(double ratePerSecond, int burstSize) {
        this(ratePerSecond, burstSize, null);
    }

    /**
     * Creates a limiter whose burst defaults to {@code max(1, floor(rate))}.
     */
    public TokenBucketRateLimiter(double ratePerSecond) {
        this(ratePerSecond, defaultBurst(ratePerSecond), null);
    }

    public static int defaultBurst(double ratePerSecond) {
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, Math.floor(ratePerSecond)));
    }

    /**
     * Blocks until one token is available, then consumes it.
     *
     * @throws InterruptedException if interrupted while waiting; no token is consumed
     */
    public void acquire() throws InterruptedException {
        acquire(1);
    }

    /**
     * Blocks until {@code permits} tokens are available, then consumes them.
     *
     * @throws InterruptedException if interrupted while waiting; no token is consumed
     */
    public void acquire(int permits) throws InterruptedException {
        if (permits <= 0 || permits > burstSize) {
            throw new IllegalArgumentException(
                    "Permits must be in [1, " + burstSize + "]: " + permits);
        }
        long start = System.nanoTime();
        lock.lockInterruptibly();
        try {
            while (true) {
                refill();
                if (tokens >= permits) {
                    tokens -= permits;
                    break;
                }
                long waitNanos = (long) Math.ceil((permits - tokens) / ratePerSecond * NANOS_PER_SECOND);
                TimeUnit.NANOSECONDS.sleep(Math.max(1, waitNanos));
            }
        } finally {
            lock.unlock();
        }
        long waited = System.nanoTime() - start;
        if (metrics != null) {
            metrics.recordRateLimiterWait(Duration.ofNanos(waited));
        }
        if (log.isTraceEnabled()) {
            log.trace("Token acquired: permits={}, waitedMs={}", permits, TimeUnit.NANOSECONDS.toMillis(waited));
        }
    }

    /**
     * Consumes one token if one is available right now.
     *
     * @return false if the bucket is empty or another caller is waiting
     */
    public boolean tryAcquire() {
        if (!lock.tryLock()) {
            return false;
        }
        try {
            refill();
            if (tokens >= 1) {
                tokens -= 1;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the current token count after refill.
     */
    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        long now = System.nanoTime();
        double elapsedSeconds = (double) (now - lastRefillNanos) / NANOS_PER_SECOND;
        tokens = Math.min(burstSize, tokens + elapsedSeconds * ratePerSecond);
        lastRefillNanos = now;
    }

    public double getRatePerSecond() {
        return ratePerSecond;
    }

    public int getBurstSize() {
        return burstSize;
    }
}
