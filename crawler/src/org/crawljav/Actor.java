package org.crawljav;

import org.crawljav.util.Url;
import org.jetbrains.annotations.Nullable;

public record Actor(long id, String name, @Nullable Url href) {
}
