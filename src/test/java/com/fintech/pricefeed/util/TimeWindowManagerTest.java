package com.fintech.pricefeed.util;

import com.fintech.pricefeed.domain.Interval;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TimeWindowManager Tests")
class TimeWindowManagerTest {

    private static final long NOW = 1_760_000_000_000L;

    @Test
    @DisplayName("Trailing window ends at query time")
    void testTrailingWindowStart() {
        assertThat(TimeWindowManager.trailingWindowStart(NOW, Interval.M1, 10)).isEqualTo(NOW - 600_000L);
        assertThat(TimeWindowManager.trailingWindowStart(NOW, Interval.D1, 1)).isEqualTo(NOW - 86_400_000L);
    }

    @ParameterizedTest(name = "offset {0}ms -> bucket {1}")
    @CsvSource({
        "0,       0",
        "59999,   0",
        "60000,   1",
        "179999,  2",
        "180000, -1",
        "-1,     -1"
    })
    @DisplayName("bucketIndex() places timestamps in [windowStart, windowStart + count * width)")
    void testBucketIndex(long offset, int expected) {
        long windowStart = TimeWindowManager.trailingWindowStart(NOW, Interval.M1, 3);
        assertThat(TimeWindowManager.bucketIndex(windowStart + offset, windowStart, Interval.M1, 3))
            .isEqualTo(expected);
    }

    @Test
    @DisplayName("bucketStart() agrees with bucketIndex()")
    void testBucketStart() {
        long windowStart = TimeWindowManager.trailingWindowStart(NOW, Interval.M5, 4);
        long start = TimeWindowManager.bucketStart(windowStart, Interval.M5, 2);

        assertThat(start).isEqualTo(windowStart + 600_000L);
        assertThat(TimeWindowManager.bucketIndex(start, windowStart, Interval.M5, 4)).isEqualTo(2);
        assertThat(TimeWindowManager.bucketIndex(start + 299_999L, windowStart, Interval.M5, 4)).isEqualTo(2);
        assertThat(TimeWindowManager.bucketIndex(start + 300_000L, windowStart, Interval.M5, 4)).isEqualTo(3);
        assertThat(TimeWindowManager.bucketIndex(start + 1, windowStart, Interval.M5, 4)).isEqualTo(2);
    }
}
