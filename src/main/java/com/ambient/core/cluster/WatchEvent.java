package com.ambient.core.cluster;

/**
 * One event from a watch stream.
 */
public record WatchEvent<T>(Type type, T object) {

    public enum Type {
        ADDED, MODIFIED, DELETED, BOOKMARK, ERROR;

        public static Type fromWire(String value) {
            if (value == null) {
                return ERROR;
            }
            try {
                return valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return ERROR;
            }
        }
    }
}
