package com.bitaware.flag;

import com.bitaware.Constants;
import com.bitaware.error.BitAwareException;
import com.bitaware.error.ErrorType;
import com.bitaware.util.Bits;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMaps;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A closed, ordered set of named power-of-two flags.
 * <p>
 * Every member is validated when the set is declared: a value that is not a positive
 * power of two, or a repeated name or value, fails the whole declaration. Members whose
 * name starts with {@link Constants#RESERVED_PREFIX} are skipped entirely.
 * <p>
 * Usage:
 * <pre>
 *   var permissions = FlagSet.of(Permission.class);
 *
 *   var custom = FlagSet.builder("Mode")
 *       .flag("READ", 1)
 *       .flag("WRITE", 2)
 *       .build();
 * </pre>
 * Instances are immutable and may be shared freely between threads.
 *
 * @param <F> member type
 */
public final class FlagSet<F extends BitFlag> implements Iterable<F> {
    @Getter
    private final String name;
    private final List<F> members;
    private final Long2ObjectMap<F> byValue;
    @Getter
    private final long total;

    private FlagSet(String name, List<F> members) {
        this.name = name;
        this.members = Collections.unmodifiableList(members);
        var index = new Long2ObjectOpenHashMap<F>(members.size());
        for (var member : members) {
            index.put(member.getValue(), member);
        }
        this.byValue = Long2ObjectMaps.unmodifiable(index);
        this.total = Bits.sum(members);
    }

    /**
     * Declare a flag set from the constants of an enum, in declaration order.
     *
     * @throws BitAwareException with {@link ErrorType#INVALID_FLAG_DEFINITION} if any
     *         non-reserved constant is not a distinct positive power of two
     */
    public static <E extends Enum<E> & BitFlag> FlagSet<E> of(Class<E> enumType) throws BitAwareException {
        Objects.requireNonNull(enumType, "Enum type cannot be null");
        return declare(enumType.getSimpleName(), List.of(enumType.getEnumConstants()));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    private static <F extends BitFlag> FlagSet<F> declare(String name, List<F> candidates) throws BitAwareException {
        var members = new ArrayList<F>(candidates.size());
        var names = new HashSet<String>();
        var values = new Long2ObjectOpenHashMap<String>();

        for (var candidate : candidates) {
            var flagName = candidate.name();
            if (flagName.startsWith(Constants.RESERVED_PREFIX)) continue;

            long value = candidate.getValue();
            if (!Bits.isPowerOfTwo(value)) {
                throw new BitAwareException(ErrorType.INVALID_FLAG_DEFINITION,
                        "Value " + value + " for '" + flagName + "' is not a power of 2");
            }
            if (!names.add(flagName)) {
                throw new BitAwareException(ErrorType.INVALID_FLAG_DEFINITION,
                        "Duplicate flag name '" + flagName + "' in " + name);
            }
            var previous = values.putIfAbsent(value, flagName);
            if (previous != null) {
                throw new BitAwareException(ErrorType.INVALID_FLAG_DEFINITION,
                        "Value " + value + " for '" + flagName + "' is already declared by '" + previous + "'");
            }
            members.add(candidate);
        }
        return new FlagSet<>(name, members);
    }

    /**
     * Find the member whose value is exactly {@code value}.
     *
     * @throws BitAwareException with {@link ErrorType#FLAG_NOT_FOUND} if no member matches
     */
    public F lookup(long value) throws BitAwareException {
        var member = byValue.get(value);
        if (member == null) {
            throw new BitAwareException(ErrorType.FLAG_NOT_FOUND,
                    value + " is not a valid " + name);
        }
        return member;
    }

    public Optional<F> find(long value) {
        return Optional.ofNullable(byValue.get(value));
    }

    /**
     * @return true if {@code value} is exactly one member's value
     */
    public boolean contains(long value) {
        return byValue.containsKey(value);
    }

    public List<F> members() {
        return members;
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * Bitwise OR of the given members.
     */
    @SafeVarargs
    public final long combine(F... flags) {
        long result = 0;
        for (var flag : flags) {
            result |= flag.getValue();
        }
        return result;
    }

    /**
     * Bitwise AND of two raw values, restricted to the bits this set declares.
     */
    public long intersect(long left, long right) {
        return left & right & total;
    }

    public Stream<F> stream() {
        return members.stream();
    }

    @Override
    public Iterator<F> iterator() {
        return members.iterator();
    }

    @Override
    public String toString() {
        return name + members;
    }

    /**
     * Collects {@code (name, value)} pairs for a flag set. Validation happens in {@link #build()}.
     */
    public static final class Builder {
        private final String name;
        private final List<BitFlag> declared = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Flag set name cannot be null");
        }

        public Builder flag(String flagName, long value) {
            Objects.requireNonNull(flagName, "Flag name cannot be null");
            declared.add(BitFlag.of(flagName, value));
            return this;
        }

        public FlagSet<BitFlag> build() throws BitAwareException {
            return declare(name, declared);
        }
    }
}
