package org.crawljav.extract;

import org.crawljav.util.Url;
import org.jetbrains.annotations.Nullable;

/**
 * An actor card from the collection listing.
 */
public record ActorRecord(String name, @Nullable Url href) {
    public boolean isValid() {
        return name != null && !name.isBlank();
    }
}
