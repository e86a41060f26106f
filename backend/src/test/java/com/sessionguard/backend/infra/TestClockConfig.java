package com.sessionguard.backend.infra;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * 테스트 전체가 공유하는 수동 시계.
 * 만료/잠금/TOTP 시간 창은 TEST_CLOCK.advance(...)로만 넘긴다.
 */
@TestConfiguration
public class TestClockConfig {

    public static final ZoneId TEST_ZONE = ZoneId.of("Asia/Seoul");

    // TOTP 30초 창의 시작점에 맞춘다
    public static final Instant TEST_START = ZonedDateTime.of(2026, 1, 1, 9, 0, 0, 0, TEST_ZONE).toInstant();

    public static final SteppingClock TEST_CLOCK = new SteppingClock(TEST_ZONE);

    public static void reset() {
        TEST_CLOCK.rewindTo(TEST_START);
    }

    @Bean
    @Primary
    Clock clock() {
        return TEST_CLOCK;
    }

    /** 명시적으로 움직일 때만 흐르는 시계. 존을 바꿔도 같은 시각을 공유한다. */
    public static final class SteppingClock extends Clock {

        private final ZoneId zone;
        private final AtomicReference<Instant> now;

        SteppingClock(ZoneId zone) {
            this(zone, new AtomicReference<>(TEST_START));
        }

        private SteppingClock(ZoneId zone, AtomicReference<Instant> sharedNow) {
            this.zone = zone;
            this.now = sharedNow;
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId newZone) {
            return newZone.equals(zone) ? this : new SteppingClock(newZone, now);
        }

        @Override
        public Instant instant() {
            return now.get();
        }

        public void advance(Duration step) {
            if (step.isNegative()) {
                throw new IllegalArgumentException("시계는 뒤로 가지 않는다: " + step);
            }
            now.updateAndGet(current -> current.plus(step));
        }

        public void rewindTo(Instant instant) {
            now.set(instant);
        }
    }
}
