package fr.lapetina.embedding.accelerator.dispatch;

import fr.lapetina.embedding.accelerator.domain.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBucketRateLimiterTest {

    @Nested
    @DisplayName("Throttling")
    class ThrottlingTests {

        @Test
        @DisplayName("should admit burst immediately and pace the rest at the rate")
        void shouldPaceAfterBurst() throws InterruptedException {
            TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(10.0, 5);

            long start = System.nanoTime();
            for (int i = 0; i < 10; i++) {
                limiter.acquire();
            }
            double seconds = (System.nanoTime() - start) / 1_000_000_000.0;

            // (10 - 5) / 10 = 0.5s lower bound
            assertThat(seconds).isGreaterThanOrEqualTo(0.4).isLessThan(1.0);
        }

        @Test
        @DisplayName("should not wait while tokens remain")
        void shouldNotWaitWithinBurst() throws InterruptedException {
            TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1.0, 3);

            long start = System.nanoTime();
            limiter.acquire();
            limiter.acquire();
            limiter.acquire();

            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(200);
        }

        @Test
        @DisplayName("should refuse tryAcquire when bucket is empty")
        void shouldRefuseTryAcquireWhenEmpty() {
            TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(0.5, 2);

            assertThat(limiter.tryAcquire()).isTrue();
            assertThat(limiter.tryAcquire()).isTrue();
            assertThat(limiter.tryAcquire()).isFalse();
            assertThat(limiter.availableTokens()).isLessThan(1.0);
        }

        @Test
        @DisplayName("should never exceed burst when refilling")
        void shouldCapTokensAtBurst() throws InterruptedException {
            TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1000.0, 4);
            Thread.sleep(20);

            assertThat(limiter.availableTokens()).isLessThanOrEqualTo(4.0);
        }

        @Test
        @DisplayName("should propagate interruption while waiting")
        void shouldPropagateInterruption() throws InterruptedException {
            TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(0.1, 1);
            limiter.acquire();

            CountDownLatch started = new CountDownLatch(1);
            AtomicBoolean interrupted = new AtomicBoolean(false);
            Thread waiter = new Thread(() -> {
                started.countDown();
                try {
                    limiter.acquire();
                } catch (InterruptedException e) {
                    interrupted.set(true);
                }
            });
            waiter.start();
            started.await();
            Thread.sleep(50);
            waiter.interrupt();
            waiter.join(2000);

            assertThat(interrupted.get()).isTrue();
        }

        @Test
        @DisplayName("should leave the token in the bucket when a waiting acquire is interrupted")
        void shouldKeepTokenAfterInterruptedAcquire() throws InterruptedException {
            TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(5.0, 1);
            limiter.acquire();

            CountDownLatch started = new CountDownLatch(1);
            AtomicBoolean interrupted = new AtomicBoolean(false);
            Thread waiter = new Thread(() -> {
                started.countDown();
                try {
                    limiter.acquire();
                } catch (InterruptedException e) {
                    interrupted.set(true);
                }
            });
            waiter.start();
            started.await();
            Thread.sleep(50);
            waiter.interrupt();
            waiter.join(2000);

            assertThat(waiter.isAlive()).isFalse();
            assertThat(interrupted.get()).isTrue();
            assertThat(limiter.availableTokens()).isGreaterThanOrEqualTo(0.0).isLessThan(1.0);

            // one token refills after 200ms
            Thread.sleep(300);
            assertThat(limiter.availableTokens()).isEqualTo(1.0);
            assertThat(limiter.tryAcquire()).isTrue();
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should default burst to floor of rate, at least one")
        void shouldDefaultBurst() {
            assertThat(new TokenBucketRateLimiter(10.7).getBurstSize()).isEqualTo(10);
            assertThat(new TokenBucketRateLimiter(0.3).getBurstSize()).isEqualTo(1);
        }

        @Test
        @DisplayName("should reject non-positive rate and burst")
        void shouldRejectInvalidParameters() {
            assertThatThrownBy(() -> new TokenBucketRateLimiter(0.0, 1))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> new TokenBucketRateLimiter(-1.0, 1))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> new TokenBucketRateLimiter(1.0, 0))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject permits outside [1, burst]")
        void shouldRejectInvalidPermits() {
            TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(10.0, 5);

            assertThatThrownBy(() -> limiter.acquire(0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> limiter.acquire(6)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
