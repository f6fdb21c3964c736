// file: src/main/java/io/topomerge/core/CounterReducer.java
package io.topomerge.core;

import java.util.function.LongBinaryOperator;

/**
 * Combining operator for optional unsigned 64-bit counters.
 * <p>
 * A counter is a nullable {@code Long}:
 *  - null:   the probe did not measure this field,
 *  - 0L:     the probe measured zero.
 * <p>
 * Values are interpreted as unsigned. SUM wraps silently on overflow past
 * 2^64 - 1; callers that need saturation must check before merging.
 */
public enum CounterReducer implements LongBinaryOperator {

    /** Unsigned addition. Used for traffic counters. */
    SUM {
        @Override public long applyAsLong(long left, long right) {
            return left + right;
        }
    },

    /** Unsigned maximum. Used for high-water marks. */
    MAX {
        @Override public long applyAsLong(long left, long right) {
            return Long.compareUnsigned(left, right) >= 0 ? left : right;
        }
    };

    /**
     * Merge {@code src} into {@code dst}.
     * <p>
     *  - src absent: dst is returned unchanged (absent stays absent).
     *  - dst absent: src is combined with 0, the identity of both reducers.
     *  - both present: the reducer is applied.
     */
    public Long merge(Long dst, Long src) {
        if (src == null) return dst;
        long base = dst == null ? 0L : dst;
        return applyAsLong(base, src);
    }
}
