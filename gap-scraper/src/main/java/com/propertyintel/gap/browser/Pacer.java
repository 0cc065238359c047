package com.propertyintel.gap.browser;

/**
 * Waits between interactions. Navigation and detail fetches pace themselves
 * through this so tests can run without real delays.
 */
@FunctionalInterface
public interface Pacer {

    void pause(long millis);

    static Pacer sleeping() {
        return millis -> {
            if (millis <= 0) return;
            try {
                Thread.sleep(millis);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        };
    }

    static Pacer none() {
        return millis -> { };
    }
}
