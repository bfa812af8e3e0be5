package org.crawljav.extract;

import org.crawljav.util.Url;
import org.jetbrains.annotations.Nullable;

/**
 * A work card from an actor's listing. {@code code} is the work's identifier on the source.
 */
public record WorkRecord(String code, @Nullable String title, @Nullable Url href) {
    public boolean isValid() {
        return code != null && !code.isBlank() && href != null && !href.toString().isBlank();
    }
}
