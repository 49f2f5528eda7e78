package de.htwsaar.mediavault.core.dedup;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HostLabelTest {

    @Test
    void knownHostsHaveFixedLabels() {
        assertEquals("Redgifs", HostLabel.of("https://media.redgifs.com/Clip.mp4"));
        assertEquals("Redd.it", HostLabel.of("https://i.redd.it/abc.jpg"));
        assertEquals("Redd.it", HostLabel.of("https://preview.reddit.com/x.png?a=1&amp;b=2"));
    }

    @Test
    void otherHostsUseSecondLevelDomain() {
        assertEquals("Imgur", HostLabel.of("https://i.imgur.com/a.gif"));
        assertEquals("Sld.it", HostLabel.of("https://cdn.sld.it/a.gif"));
        assertEquals("Localhost", HostLabel.of("http://localhost:8080/a.gif"));
    }

    @Test
    void unparsableUrlsAreUnknown() {
        assertEquals("Unknown", HostLabel.of(null));
        assertEquals("Unknown", HostLabel.of("no url at all"));
        assertEquals("Unknown", HostLabel.of("mailto:someone"));
    }
}
