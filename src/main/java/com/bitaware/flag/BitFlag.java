package com.bitaware.flag;

/**
 * A named member of a {@link FlagSet}, representing a single bit.
 * <p>
 * Enums implement this interface directly, their {@code name()} satisfies the contract:
 * <pre>
 *   enum Permission implements BitFlag {
 *       READ(1), WRITE(2), EXEC(4);
 *
 *       &#64;Getter
 *       private final long value;
 *
 *       Permission(long value) { this.value = value; }
 *   }
 * </pre>
 */
public interface BitFlag {

    String name();

    long getValue();

    /**
     * Create a free-standing flag. No power-of-two check is applied until the flag
     * is declared as part of a {@link FlagSet}.
     */
    static BitFlag of(String name, long value) {
        return new SimpleFlag(name, value);
    }
}
