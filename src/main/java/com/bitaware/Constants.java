package com.bitaware;

public final class Constants {
    public static final String RESERVED_PREFIX = "_";
    public static final String DEFAULT_TYPE_NAME = "BitAware";

    private Constants() {}
}
