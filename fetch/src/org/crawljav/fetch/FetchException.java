package org.crawljav.fetch;

import org.crawljav.util.Url;

public class FetchException extends Exception {
    protected final Url url;

    public FetchException(Url url, String message) {
        super(message + " for " + url);
        this.url = url;
    }

    public FetchException(Url url, String message, Throwable cause) {
        super(message + " for " + url, cause);
        this.url = url;
    }

    public Url url() {
        return url;
    }
}
