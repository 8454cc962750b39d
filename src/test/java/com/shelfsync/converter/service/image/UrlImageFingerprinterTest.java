package com.shelfsync.converter.service.image;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UrlImageFingerprinterTest {
    private final UrlImageFingerprinter fingerprinter = new UrlImageFingerprinter();

    @Test
    public void equivalentUrlsShareFingerprint() {
        String a = fingerprinter.fingerprint("https://CDN.Example//img/1.jpg?size=big#top");
        String b = fingerprinter.fingerprint("https://cdn.example/img/1.jpg");
        assertEquals(a, b);
        assertEquals(64, a.length());
    }

    @Test
    public void pathCaseMatters() {
        assertNotEquals(fingerprinter.fingerprint("https://cdn.example/img/A.jpg"),
                fingerprinter.fingerprint("https://cdn.example/img/a.jpg"));
    }

    @Test
    public void relativeUrlsLoseQuery() {
        assertEquals("images/a.jpg", UrlImageFingerprinter.normalize(" images/a.jpg?v=2 "));
    }
}
