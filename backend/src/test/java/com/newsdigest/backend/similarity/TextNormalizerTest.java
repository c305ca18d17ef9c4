package com.newsdigest.backend.similarity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    @Test
    @DisplayName("Source suffixes, city prefixes and brackets are stripped from titles")
    void stripsTitleNoise() {
        assertEquals("port fire contained", TextNormalizer.normalize("Port fire contained | Daily Wire"));
        assertEquals("port fire contained", TextNormalizer.normalize("Port fire contained - Daily Wire"));
        assertEquals("port fire contained", TextNormalizer.normalize("Lisbon: Port fire contained"));
        assertEquals("port fire contained", TextNormalizer.normalize("Port fire (updated) contained [video]"));
    }

    @Test
    @DisplayName("A noise rule that would blank the title is not applied")
    void keepsTitleWhenRuleWouldEatIt() {
        assertEquals("breaking", TextNormalizer.normalize("(Breaking)"));
    }

    @Test
    void bodyNormalizationKeepsDashedClauses() {
        assertEquals("rates rise again analysts say", TextNormalizer.normalizeBody("Rates rise again - analysts say!"));
    }

    @Test
    void blankInputNormalizesToEmpty() {
        assertEquals("", TextNormalizer.normalize(null));
        assertEquals("", TextNormalizer.normalize("   "));
        assertEquals("", TextNormalizer.normalizeBody(null));
    }

    @Test
    @DisplayName("Fingerprints ignore title noise and source case but not the source itself")
    void fingerprintUsesNormalizedTitleAndSource() {
        String a = TextNormalizer.fingerprint("Port fire contained | Daily Wire", "Wire");
        String b = TextNormalizer.fingerprint("port fire contained!", " wire ");
        String other = TextNormalizer.fingerprint("port fire contained", "gazette");

        assertEquals(a, b);
        assertNotEquals(a, other);
        assertEquals(32, a.length());
    }
}
