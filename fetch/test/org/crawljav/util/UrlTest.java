package org.crawljav.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UrlTest {

    @Test
    void resolve() {
        Url base = new Url("https://javdb.com/actors/abc?page=2");
        assertEquals(new Url("https://javdb.com/v/x1"), base.resolve("/v/x1"));
        assertEquals(new Url("https://other.example/"), base.resolve("https://other.example/"));
        assertSame(base, base.resolve(" "));
    }

    @Test
    void queryParameters() {
        Url url = new Url("https://javdb.com/actors/abc?t=s%2Cd&sort_type=0&flag#top");
        assertEquals(List.of(Map.entry("t", "s,d"), Map.entry("sort_type", "0"), Map.entry("flag", "")),
                url.queryParameters());
        assertEquals("https://javdb.com/actors/abc", url.withoutQuery());
        assertTrue(new Url("https://javdb.com/").queryParameters().isEmpty());
    }

    @Test
    void withQueryParameters() {
        Url url = new Url("https://javdb.com/actors/abc?old=1");
        assertEquals(new Url("https://javdb.com/actors/abc?t=s%2Cd&q=a+b"),
                url.withQueryParameters(List.of(Map.entry("t", "s,d"), Map.entry("q", "a b"))));
    }

    @Test
    void orNull() {
        assertNull(Url.orNull(null));
        assertNull(Url.orNull("  "));
        assertEquals(new Url("https://javdb.com/"), Url.orNull(" https://javdb.com/ "));
    }
}
