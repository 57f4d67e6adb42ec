package com.earlywarning.analyzer.feature;

/**
 * Lexical and structural features of a single URL.
 *
 * <p>
 * Computed once per analysis by {@link UrlFeatureExtractor}. Every field is
 * derived from the URL string alone, so two extractions of the same string are
 * always equal.
 * </p>
 *
 * @param length                 code points in the raw URL, the same unit {@code entropy} counts
 * @param dotCount               number of '.' characters
 * @param hasIpHost              host is an IPv4/IPv6 literal or could not be parsed
 * @param suspiciousKeywordCount distinct phishing/ransomware pretext keywords found
 * @param domainAgeDays          simulated domain age, {@link #UNKNOWN_DOMAIN_AGE} when absent
 * @param tldRiskScore           1.0 for a high-risk top-level domain, else 0.0
 * @param usesHttps              scheme is https
 * @param subdomainCount         host labels in front of the registrable domain
 * @param entropy                base-2 Shannon entropy of the URL characters
 *
 * @author Naveed Gung
 */
public record UrlFeatures(
        int length,
        int dotCount,
        boolean hasIpHost,
        int suspiciousKeywordCount,
        int domainAgeDays,
        double tldRiskScore,
        boolean usesHttps,
        int subdomainCount,
        double entropy) {

    /** Sentinel for "no simulated age available" (IP literal or unparsable host). */
    public static final int UNKNOWN_DOMAIN_AGE = -1;

    public boolean hasDomainAge() {
        return domainAgeDays != UNKNOWN_DOMAIN_AGE;
    }
}
