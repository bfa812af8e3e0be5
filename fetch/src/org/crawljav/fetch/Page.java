package org.crawljav.fetch;

import org.crawljav.util.Url;
import org.jetbrains.annotations.NotNull;

/**
 * A fetched page.
 *
 * @param url    final URL of the page after redirects
 * @param status HTTP status code
 * @param body   decoded response body
 */
public record Page(@NotNull Url url, int status, @NotNull String body) {
}
