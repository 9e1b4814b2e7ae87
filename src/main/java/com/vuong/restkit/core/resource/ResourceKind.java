package com.vuong.restkit.core.resource;

/**
 * Whether a resource answers on its collection path or on the path of a single item.
 */
public enum ResourceKind {
    /** {@code {prefix}/{name}} */
    COLLECTION,
    /** {@code {prefix}/{name}/{id}} */
    ITEM
}
