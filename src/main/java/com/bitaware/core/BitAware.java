package com.bitaware.core;

import com.bitaware.Constants;
import com.bitaware.error.BitAwareException;
import com.bitaware.flag.BitFlag;
import com.bitaware.flag.FlagSet;
import com.bitaware.util.Bits;
import lombok.Getter;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A positive integer that knows which flags of its {@link FlagSet} it has set.
 * <p>
 * Values are immutable. Iterating a bound value yields its active members in declaration
 * order; iterating an unbound value yields a single flag carrying the raw number.
 * Two values are equal when their numbers are equal, whatever their type or flag set.
 *
 * @param <F> member type of the bound flag set
 */
public final class BitAware<F extends BitFlag> implements Iterable<F> {
    private final long value;
    @Getter
    private final BitAwareType<F> type;

    BitAware(long value, BitAwareType<F> type) {
        this.value = value;
        this.type = type;
    }

    public static BitAware<BitFlag> of(long value) throws BitAwareException {
        return BitAwareType.defaultType().of(value);
    }

    public static <F extends BitFlag> BitAware<F> of(long value, FlagSet<F> flags) throws BitAwareException {
        return BitAwareType.bound(Constants.DEFAULT_TYPE_NAME, flags).of(value);
    }

    public static BitAware<BitFlag> validate(Object input) throws BitAwareException {
        return BitAwareType.defaultType().validate(input);
    }

    public boolean has(BitFlag flag) {
        return has(flag.getValue());
    }

    public boolean has(long flag) {
        return Bits.intersects(value, flag);
    }

    public long longValue() {
        return value;
    }

    /**
     * @throws ArithmeticException if the value does not fit in an int
     */
    public int intValue() {
        return Math.toIntExact(value);
    }

    public boolean isBound() {
        return type.isBound();
    }

    public Optional<FlagSet<F>> getFlags() {
        return type.getFlags();
    }

    public List<F> activeFlags() {
        return stream().collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    public Stream<F> stream() {
        var flags = type.getFlags();
        if (flags.isPresent()) {
            return flags.get().stream().filter(this::has);
        }
        // unbound types are always BitAwareType<BitFlag>
        return Stream.of((F) BitFlag.of(Long.toString(value), value));
    }

    @Override
    public Iterator<F> iterator() {
        return stream().iterator();
    }

    public boolean equalsValue(long other) {
        return value == other;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BitAware)) return false;
        return value == ((BitAware<?>) obj).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    /**
     * Render as {@code "label [A, B]"}. The label is the configured display label for this
     * value if there is one, else the name of the member equal to it, else the number itself.
     * Unbound values render as the plain number.
     */
    @Override
    public String toString() {
        var flags = type.getFlags();
        if (flags.isEmpty()) {
            return Long.toString(value);
        }
        var set = flags.get();
        var label = type.label(value)
                .orElseGet(() -> set.find(value).map(BitFlag::name).orElse(Long.toString(value)));
        var names = stream().map(BitFlag::name).collect(Collectors.joining(", "));
        return label + " [" + names + "]";
    }

    /**
     * Render as {@code "Type(Set.A | Set.B)"}, or {@code "Type(9)"} when unbound.
     */
    public String toDebugString() {
        var flags = type.getFlags();
        if (flags.isEmpty()) {
            return type.getName() + "(" + value + ")";
        }
        var setName = flags.get().getName();
        var members = stream()
                .map(flag -> setName + "." + flag.name())
                .collect(Collectors.joining(" | "));
        return type.getName() + "(" + members + ")";
    }
}
