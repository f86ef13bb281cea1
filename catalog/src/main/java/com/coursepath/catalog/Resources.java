package com.coursepath.catalog;

import java.io.InputStream;

final class Resources {
    private Resources() {}

    /**
     * @throws IllegalArgumentException if the resource is not on the classpath
     */
    static InputStream open(String resourceName) {
        InputStream is = tryOpen(resourceName);
        if (is == null) throw new IllegalArgumentException("Resource not found on classpath: " + resourceName);
        return is;
    }

    /** Context class loader first, then this module's own. Returns null when absent. */
    static InputStream tryOpen(String resourceName) {
        String normalized = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
        ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        InputStream is = (ctx != null) ? ctx.getResourceAsStream(normalized) : null;
        if (is != null) return is;
        return Resources.class.getClassLoader().getResourceAsStream(normalized);
    }
}
