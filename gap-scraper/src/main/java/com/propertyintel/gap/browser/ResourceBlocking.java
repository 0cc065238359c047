package com.propertyintel.gap.browser;

import com.microsoft.playwright.BrowserContext;

import java.util.Set;

/**
 * Aborts requests for heavy resource types (images, fonts, media) at the
 * network layer of a context.
 */
public final class ResourceBlocking {

    private ResourceBlocking() {
    }

    public static void apply(BrowserContext context, Set<String> blockedTypes) {
        if (blockedTypes.isEmpty()) return;
        context.route("**/*", route -> {
            if (blockedTypes.contains(route.request().resourceType())) {
                route.abort();
            } else {
                route.resume();
            }
        });
    }
}
