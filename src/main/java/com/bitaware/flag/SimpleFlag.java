package com.bitaware.flag;

import lombok.EqualsAndHashCode;

import java.util.Objects;

/**
 * A flag declared by name and value rather than as an enum constant.
 */
@EqualsAndHashCode
public final class SimpleFlag implements BitFlag {
    private final String name;
    private final long value;

    SimpleFlag(String name, long value) {
        this.name = Objects.requireNonNull(name, "Flag name cannot be null");
        this.value = value;
    }

    @Override
    public String name() { return name; }

    @Override
    public long getValue() { return value; }

    @Override
    public String toString() {
        return name;
    }
}
