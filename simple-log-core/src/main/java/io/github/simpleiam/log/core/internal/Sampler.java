package io.github.simpleiam.log.core.internal;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.simpleiam.log.api.Level;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * (레벨, 메시지)별 1초 단위 샘플링.
 *
 * 각 tick에서 처음 initial건은 통과, 이후에는 thereafter건마다 1건만 통과한다.
 * 카운터는 Caffeine 캐시에 두어 메시지 종류가 많아도 메모리를 제한한다.
 */
class Sampler {

    static final long TICK_NANOS = Duration.ofSeconds(1).toNanos();

    private final int initial;
    private final int thereafter;
    private final LongSupplier nanoClock;
    private final Cache<SampleKey, Counter> counters;

    Sampler(int initial, int thereafter) {
        this(initial, thereafter, System::nanoTime);
    }

    Sampler(int initial, int thereafter, LongSupplier nanoClock) {
        this.initial = initial;
        this.thereafter = thereafter;
        this.nanoClock = nanoClock;
        this.counters = Caffeine.newBuilder()
                .maximumSize(4_096)
                .expireAfterAccess(Duration.ofSeconds(10))
                .build();
    }

    /** @return true면 기록, false면 버림 */
    boolean sample(Level level, String message) {
        Counter counter = counters.get(new SampleKey(level, message), key -> new Counter());
        long n = counter.incrementAndGet(nanoClock.getAsLong());
        if (n <= initial) {
            return true;
        }
        return (n - initial) % thereafter == 0;
    }

    private static final class Counter {
        private final AtomicLong tickStart = new AtomicLong(Long.MIN_VALUE);
        private final AtomicLong count = new AtomicLong();

        long incrementAndGet(long now) {
            long start = tickStart.get();
            if (start == Long.MIN_VALUE || now - start >= TICK_NANOS) {
                if (tickStart.compareAndSet(start, now)) {
                    count.set(1);
                    return 1;
                }
            }
            return count.incrementAndGet();
        }
    }

    private static final class SampleKey {
        private final Level level;
        private final String message;

        SampleKey(Level level, String message) {
            this.level = level;
            this.message = message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SampleKey)) return false;
            SampleKey that = (SampleKey) o;
            return level == that.level && Objects.equals(message, that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(level, message);
        }
    }
}
