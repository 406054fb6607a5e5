package com.silentrisk.common.health;

/**
 * Connectivity check for one external dependency.
 */
public interface DependencyProbe {

    String name();

    /**
     * @return true when the dependency answered within its timeout
     */
    boolean isUp();
}
