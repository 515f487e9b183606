package com.openstable.common.util;

/**
 * Common constants shared by the sync modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String DEFAULT_KEY_FIELD = "id";
    public static final String TEMP_ID_PREFIX = "tmp-";
    public static final String NO_FILTER_HASH = "all";

    public static final int MAX_PAGE_SIZE = 100;

    public static final int MAX_LIFECYCLE_EVENTS = 100;
}
