package org.crawljav;

import org.crawljav.util.Url;
import org.jetbrains.annotations.Nullable;

public record Work(long id, long actorId, String code, @Nullable String title, @Nullable Url href) {
}
