package com.bitaware.core;

import com.bitaware.Constants;
import com.bitaware.error.BitAwareException;
import com.bitaware.error.ErrorType;
import com.bitaware.flag.BitFlag;
import com.bitaware.flag.FlagSet;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMaps;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import lombok.Getter;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes a kind of {@link BitAware} value: the name shown in debug output, the flag set
 * values are bound to (if any) and display labels for well-known values.
 * <p>
 * Usage:
 * <pre>
 *   var access = BitAwareType.builder("Access", FlagSet.of(Permission.class))
 *       .label(7, "ALL")
 *       .build();
 *
 *   var rw = access.of(3);        // "3 [READ, WRITE]"
 *   var all = access.of(7);       // "ALL [READ, WRITE, EXEC]"
 * </pre>
 *
 * @param <F> member type of the bound flag set
 */
public final class BitAwareType<F extends BitFlag> {
    private static final BitAwareType<BitFlag> DEFAULT = unbound(Constants.DEFAULT_TYPE_NAME);

    @Getter
    private final String name;
    private final FlagSet<F> flags;
    private final Long2ObjectMap<String> labels;

    private BitAwareType(String name, FlagSet<F> flags, Long2ObjectMap<String> labels) {
        this.name = Objects.requireNonNull(name, "Type name cannot be null");
        this.flags = flags;
        this.labels = Long2ObjectMaps.unmodifiable(new Long2ObjectOpenHashMap<>(labels));
    }

    public static BitAwareType<BitFlag> unbound(String name) {
        return new BitAwareType<>(name, null, new Long2ObjectOpenHashMap<>());
    }

    public static <F extends BitFlag> BitAwareType<F> bound(String name, FlagSet<F> flags) {
        return builder(name, flags).build();
    }

    public static <F extends BitFlag> Builder<F> builder(String name, FlagSet<F> flags) {
        return new Builder<>(name, flags);
    }

    static BitAwareType<BitFlag> defaultType() {
        return DEFAULT;
    }

    public Optional<FlagSet<F>> getFlags() {
        return Optional.ofNullable(flags);
    }

    public boolean isBound() {
        return flags != null;
    }

    public Optional<String> label(long value) {
        return Optional.ofNullable(labels.get(value));
    }

    /**
     * Wrap a raw value.
     *
     * @throws BitAwareException {@link ErrorType#NON_POSITIVE_VALUE} if value is zero or negative,
     *         {@link ErrorType#VALUE_OUT_OF_RANGE} if value is larger than the sum of all flags
     */
    public BitAware<F> of(long value) throws BitAwareException {
        if (value <= 0) {
            throw new BitAwareException(ErrorType.NON_POSITIVE_VALUE, "value must be positive: " + value);
        }
        // Bound only, bits below the total that no member declares are accepted.
        if (flags != null && value > flags.getTotal()) {
            throw new BitAwareException(ErrorType.VALUE_OUT_OF_RANGE,
                    "value exceeds possible flag setup: " + value + " > " + flags.getTotal());
        }
        return new BitAware<>(value, this);
    }

    @SafeVarargs
    public final BitAware<F> of(F... members) throws BitAwareException {
        long value = 0;
        for (var member : members) {
            value |= member.getValue();
        }
        return of(value);
    }

    /**
     * Coerce arbitrary input into a value of this type, for use by schema and validation layers.
     * A value of this type passes through untouched; another {@code BitAware} or an integral
     * number is re-validated against this type.
     *
     * @throws BitAwareException {@link ErrorType#TYPE_MISMATCH} if input is not an integer,
     *         otherwise as {@link #of(long)}
     */
    @SuppressWarnings("unchecked")
    public BitAware<F> validate(Object input) throws BitAwareException {
        if (input instanceof BitAware) {
            var value = (BitAware<?>) input;
            if (value.getType() == this) {
                return (BitAware<F>) value;
            }
            return of(value.longValue());
        }
        return of(toLong(input));
    }

    private static long toLong(Object input) throws BitAwareException {
        if (input instanceof Long || input instanceof Integer || input instanceof Short || input instanceof Byte) {
            return ((Number) input).longValue();
        }
        if (input instanceof BigInteger) {
            var big = (BigInteger) input;
            if (big.signum() <= 0) {
                throw new BitAwareException(ErrorType.NON_POSITIVE_VALUE, "value must be positive: " + big);
            }
            if (big.bitLength() >= Long.SIZE) {
                throw new BitAwareException(ErrorType.VALUE_OUT_OF_RANGE,
                        "value exceeds possible flag setup: " + big);
            }
            return big.longValue();
        }
        var actual = input == null ? "null" : input.getClass().getSimpleName();
        throw new BitAwareException(ErrorType.TYPE_MISMATCH, "expected integer, got " + actual);
    }

    @Override
    public String toString() {
        return flags == null ? name : name + "<" + flags.getName() + ">";
    }

    public static final class Builder<F extends BitFlag> {
        private final String name;
        private final FlagSet<F> flags;
        private final Long2ObjectMap<String> labels = new Long2ObjectOpenHashMap<>();

        private Builder(String name, FlagSet<F> flags) {
            this.name = Objects.requireNonNull(name, "Type name cannot be null");
            this.flags = Objects.requireNonNull(flags, "Flag set cannot be null");
        }

        /**
         * Display {@code label} instead of the member name or raw number when a value equals
         * {@code value}. A later call for the same value replaces the earlier label.
         */
        public Builder<F> label(long value, String label) {
            labels.put(value, Objects.requireNonNull(label, "Label cannot be null"));
            return this;
        }

        public Builder<F> labels(Map<Long, String> entries) {
            for (var entry : entries.entrySet()) {
                label(entry.getKey(), entry.getValue());
            }
            return this;
        }

        public BitAwareType<F> build() {
            return new BitAwareType<>(name, flags, labels);
        }
    }
}
