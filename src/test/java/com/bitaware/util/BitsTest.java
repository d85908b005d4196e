package com.bitaware.util;

import com.bitaware.flag.BitFlag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BitsTest {

    @ParameterizedTest
    @ValueSource(longs = {1L, 2L, 4L, 8L, 1024L, 1L << 40, Long.MIN_VALUE >>> 1})
    void shouldAcceptPowersOfTwo(long value) {
        assertThat(Bits.isPowerOfTwo(value)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(longs = {0L, -1L, -4L, 3L, 6L, 12L, Long.MAX_VALUE, Long.MIN_VALUE})
    void shouldRejectEverythingElse(long value) {
        assertThat(Bits.isPowerOfTwo(value)).isFalse();
    }

    @Test
    void shouldTestIntersection() {
        assertThat(Bits.intersects(0b101, 0b001)).isTrue();
        assertThat(Bits.intersects(0b101, 0b010)).isFalse();
        assertThat(Bits.intersects(0b101, 0b110)).isTrue();
    }

    @Test
    void shouldSumFlagValues() {
        var flags = List.of(BitFlag.of("A", 1), BitFlag.of("B", 2), BitFlag.of("C", 16));
        assertThat(Bits.sum(flags)).isEqualTo(19L);
        assertThat(Bits.sum(List.of())).isZero();
    }
}
