package com.ambient.core.cluster;

/**
 * Asks the cluster whether the bound identity may perform an action.
 */
public interface AccessReviewer {

    boolean isAllowed(String namespace, String group, String resource, String verb);
}
