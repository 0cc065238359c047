package com.propertyintel.gap.browser;

import java.util.concurrent.Callable;

/**
 * One completed network exchange observed on a tab.
 *
 * The body is read lazily: most responses are classified by URL alone and
 * never need their payload.
 */
public record CapturedResponse(String url, Callable<String> body) {

    public static CapturedResponse of(String url, String body) {
        return new CapturedResponse(url, () -> body);
    }

    public String readBody() throws Exception {
        return body.call();
    }
}
