package io.itemapi.core;

/**
 * Wire constants for the item API.
 */
public final class Protocol {
    private Protocol() {}

    // Paths
    public static final String ITEMS_PATH = "/items";
    public static final String ITEM_PATH = "/items/{id}";
    public static final String P_ID = "id";

    // Headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_ALLOW = "Allow";

    // Content types
    public static final String CT_JSON = "application/json";
    public static final String CT_TEXT = "text/plain; charset=utf-8";
}
