package de.htwsaar.mediavault.core.normalize;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class UrlNormalizerTest {

    private final UrlNormalizer normalizer = UrlNormalizer.withDefaults();

    @Test
    void ephemeralParams_areRemoved_otherParamsKeepOrder() {
        String url = "https://cdn.example/x.jpg?b=2&sig=abc123&a=1&utm_source=feed&Expires=99";

        assertEquals("https://cdn.example/x.jpg?b=2&a=1", normalizer.normalize(url));
    }

    @Test
    void differentSignatures_yieldSameKey() {
        String first = normalizer.normalize("https://cdn.example/x.jpg?sig=abc123");
        String second = normalizer.normalize("https://cdn.example/x.jpg?sig=zzz999");

        assertEquals(first, second);
        assertEquals("https://cdn.example/x.jpg", first, "leere Query muss samt '?' entfallen");
    }

    @Test
    void stripQueryHosts_dropQueryAndFragment() {
        assertEquals("https://i.redd.it/abc.jpg", normalizer.normalize("https://i.redd.it/abc.jpg?width=640&format=pjpg#x"));
        assertEquals(
                "https://external-preview.redd.it/abc.png",
                normalizer.normalize("https://external-preview.redd.it/abc.png?auto=webp&s=deadbeef"));
        assertEquals("https://media.redgifs.com/Foo.mp4", normalizer.normalize("https://media.redgifs.com/Foo.mp4?for=1"));
    }

    @Test
    void suffixRule_respectsDotBoundary() {
        String url = "https://notredgifs.com/a.mp4?x=1";

        assertEquals(url, normalizer.normalize(url), "kein Treffer ohne Punkt-Grenze");
    }

    @Test
    void htmlEscapedAmpersand_isDecoded() {
        assertEquals(
                "https://cdn.example/a.png?w=1&h=2",
                normalizer.normalize("https://cdn.example/a.png?w=1&amp;token=t&amp;amp;h=2"));
    }

    @Test
    void fragment_isKeptForOrdinaryHosts() {
        assertEquals("https://cdn.example/a.png?w=1#top", normalizer.normalize("https://cdn.example/a.png?w=1&st=5#top"));
    }

    @Test
    void unparseableInput_isReturnedUnchanged() {
        assertEquals("not a url", normalizer.normalize("not a url"));
        assertEquals("mailto:someone@example.org", normalizer.normalize("mailto:someone@example.org"));
        assertEquals("/relative/path?sig=1", normalizer.normalize("/relative/path?sig=1"));
        assertNull(normalizer.normalize(null));
    }

    @Test
    void normalize_isIdempotent() {
        List<String> samples = List.of(
                "https://cdn.example/x.jpg?sig=abc123",
                "https://i.redd.it/abc.jpg?width=640",
                "https://cdn.example/a.png?w=1&amp;amp;token=t#frag",
                "https://cdn.example/a.png?&&w=1&&",
                "https://cdn.example/%20space.png?q=a%26b",
                "http://[::1]:8080/v.mp4?utm_medium=x",
                "not a url",
                "");

        for (String u : samples) {
            String once = normalizer.normalize(u);
            assertEquals(once, normalizer.normalize(once), "nicht idempotent für " + u);
        }
    }

    @Test
    void configuredRules_extendDefaults() {
        UrlNormalizer custom = new UrlNormalizer(List.of(HostRule.parse(".signed.example"), HostRule.parse("one.example")));

        assertEquals("https://a.signed.example/f.gif", custom.normalize("https://a.signed.example/f.gif?page=2"));
        assertEquals("https://one.example/f.gif", custom.normalize("https://one.example/f.gif?page=2"));
        assertEquals("https://two.one.example/f.gif?page=2", custom.normalize("https://two.one.example/f.gif?page=2"));
    }

    @Test
    void hostRule_parse_distinguishesSuffixAndExact() {
        assertEquals(HostRule.suffix("redgifs.com"), HostRule.parse(".Redgifs.com"));
        assertEquals(HostRule.exact("i.redd.it"), HostRule.parse(" i.redd.it "));
        assertThrows(IllegalArgumentException.class, () -> HostRule.parse("   "));
    }

    @Test
    void ephemeralParamCheck_isCaseInsensitive() {
        assertTrue(UrlNormalizer.isEphemeralParam("SIG"));
        assertTrue(UrlNormalizer.isEphemeralParam("UTM_campaign"));
        assertFalse(UrlNormalizer.isEphemeralParam("size"));
    }
}
