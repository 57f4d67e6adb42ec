package com.earlywarning.analyzer.feature;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class UrlFeatureExtractorTest {

    private UrlFeatureExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new UrlFeatureExtractor();
    }

    @Test
    void shouldExtractBasicFeaturesForBenignUrl() {
        UrlFeatures f = extractor.extract("https://google.com");

        assertEquals(18, f.length());
        assertEquals(1, f.dotCount());
        assertFalse(f.hasIpHost());
        assertEquals(0, f.suspiciousKeywordCount());
        assertEquals(0.0, f.tldRiskScore());
        assertTrue(f.usesHttps());
        assertEquals(0, f.subdomainCount());
        assertTrue(f.hasDomainAge());
        assertEquals(3.5724, f.entropy(), 1e-4);
    }

    @Test
    void shouldTreatNullAsEmpty() {
        UrlFeatures f = extractor.extract(null);

        assertEquals(0, f.length());
        assertEquals(0.0, f.entropy());
        assertFalse(f.usesHttps());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "://", "not a url", "http://[", "http://[zz]/", "http://%%%/",
            "\u0000\u0001", "http://exa mple.com/", "https://user:pw@:80/", "http://пример.рф/путь"})
    void shouldNeverThrowOnMalformedInput(String url) {
        UrlFeatures f = assertDoesNotThrow(() -> extractor.extract(url));
        assertEquals(url.codePointCount(0, url.length()), f.length());
        assertEquals(url.chars().filter(c -> c == '.').count(), f.dotCount());
        assertTrue(f.suspiciousKeywordCount() >= 0);
        assertTrue(f.subdomainCount() >= 0);
        assertTrue(f.tldRiskScore() >= 0.0 && f.tldRiskScore() <= 1.0);
        assertTrue(f.entropy() >= 0.0);
        assertTrue(f.domainAgeDays() >= 0 || f.domainAgeDays() == UrlFeatures.UNKNOWN_DOMAIN_AGE);
    }

    @Test
    void shouldCountLengthInCodePoints() {
        String url = "https://example.com/\uD83D\uDD12";

        UrlFeatures f = extractor.extract(url);

        assertEquals(21, f.length());
        assertEquals(UrlFeatureExtractor.shannonEntropy(url), f.entropy());
    }

    @Test
    void shouldHandleVeryLongInput() {
        String url = "http://example.com/" + "a".repeat(100_000);

        UrlFeatures f = extractor.extract(url);

        assertEquals(url.length(), f.length());
        assertFalse(f.hasIpHost());
    }

    @Test
    void shouldDetectDottedIpv4Host() {
        UrlFeatures f = extractor.extract("http://192.168.1.1/pay");

        assertTrue(f.hasIpHost());
        assertFalse(f.usesHttps());
        assertEquals(3, f.dotCount());
        assertEquals(UrlFeatures.UNKNOWN_DOMAIN_AGE, f.domainAgeDays());
        assertEquals(0.0, f.tldRiskScore());
    }

    @ParameterizedTest
    @ValueSource(strings = {"http://0xC0A80101/", "http://3232235777/", "http://0300.0250.1.1/",
            "http://192.168.257/", "http://127.1:8080/admin"})
    void shouldDetectAlternateIpv4Notations(String url) {
        assertTrue(extractor.extract(url).hasIpHost());
    }

    @Test
    void shouldDetectIpv6Host() {
        assertTrue(extractor.extract("http://[::1]/").hasIpHost());
        assertTrue(extractor.extract("https://[2001:db8::7]:8443/login").hasIpHost());
    }

    @Test
    void shouldScoreUnparsableHostLikeIpHost() {
        UrlFeatures f = extractor.extract("http://exa mple.com/");

        assertTrue(f.hasIpHost());
        assertFalse(f.hasDomainAge());
    }

    @Test
    void shouldUseHostAfterUserInfo() {
        UrlFeatures f = extractor.extract("http://paypal.com@evil.xyz/");

        assertFalse(f.hasIpHost());
        assertEquals(1.0, f.tldRiskScore());
    }

    @Test
    void shouldCountDistinctSuspiciousKeywordsCaseInsensitively() {
        UrlFeatures f = extractor.extract("http://SECURE-login-verify.example.com/verify");

        assertEquals(3, f.suspiciousKeywordCount());
    }

    @Test
    void shouldFlagHighRiskTld() {
        assertEquals(1.0, extractor.extract("https://update.microsoft.xyz/verify").tldRiskScore());
        assertEquals(0.0, extractor.extract("https://microsoft.com").tldRiskScore());
    }

    @Test
    void shouldCountSubdomainsAgainstPublicSuffix() {
        assertEquals(1, extractor.extract("https://www.google.com").subdomainCount());
        assertEquals(3, extractor.extract("https://a.b.c.example.co.uk/").subdomainCount());
        assertEquals(0, extractor.extract("https://example.co.uk/").subdomainCount());
    }

    @Test
    void shouldDetectHttpsSchemeCaseInsensitively() {
        assertTrue(extractor.extract("HTTPS://example.com").usesHttps());
        assertFalse(extractor.extract("example.com").usesHttps());
    }

    @Test
    void shouldComputeShannonEntropy() {
        assertEquals(0.0, UrlFeatureExtractor.shannonEntropy(""));
        assertEquals(0.0, UrlFeatureExtractor.shannonEntropy("aaaa"), 1e-12);
        assertEquals(1.0, UrlFeatureExtractor.shannonEntropy("ab"), 1e-12);
        assertEquals(2.0, UrlFeatureExtractor.shannonEntropy("abcd"), 1e-12);
    }

    @Test
    void shouldBeDeterministic() {
        String url = "https://secure-update.wallet-support.top/confirm?id=8f3a";

        assertEquals(extractor.extract(url), extractor.extract(url));
        assertEquals(extractor.extract(url).domainAgeDays(), extractor.extract(url).domainAgeDays());
    }

    @Test
    void shouldKeepSimulatedAgeWithinRange() {
        for (String domain : new String[] {"google.com", "example.com", "evil.xyz", "a.b"}) {
            int age = UrlFeatureExtractor.simulatedDomainAge(domain);
            assertTrue(age >= 0 && age < UrlFeatureExtractor.SIMULATED_AGE_RANGE_DAYS, domain + " -> " + age);
        }
    }

    @Test
    void shouldShareSimulatedAgeAcrossSubdomains() {
        assertEquals(
                extractor.extract("https://google.com").domainAgeDays(),
                extractor.extract("https://mail.google.com/inbox").domainAgeDays());
    }

    @Test
    void shouldVectorizeInSchemaOrder() {
        UrlFeatures f = extractor.extract("http://192.168.1.1/pay");
        double[] v = FeatureSchema.V1.vectorize(f);

        assertEquals(FeatureSchema.V1.size(), v.length);
        assertEquals(22.0, v[0]);
        assertEquals(3.0, v[1]);
        assertEquals(1.0, v[2]);
        assertEquals(0.0, v[3]);
        assertEquals(f.entropy(), v[7]);
    }
}
