package com.earlywarning.analyzer.feature;

import com.google.common.hash.Hashing;
import com.google.common.net.InternetDomainName;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a raw URL string into {@link UrlFeatures}.
 *
 * <p>
 * Extraction is a total function: malformed or obfuscated input never throws,
 * it degrades to the most suspicious reading instead (an unparsable host is
 * scored like an IP-literal host). Heuristics:
 * </p>
 * <ul>
 * <li>IPv4 literals in dotted, integer, hex and octal notation, plus IPv6</li>
 * <li>Phishing and ransomware pretext vocabulary</li>
 * <li>High-risk top-level domains</li>
 * <li>Subdomain depth against the public suffix list</li>
 * <li>Character entropy as an obfuscation signal</li>
 * </ul>
 *
 * <p>
 * The domain age is <b>simulated</b>: a stable hash of the registrable domain,
 * not a WHOIS lookup. It is only a weak signal and carries no ground truth.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class UrlFeatureExtractor {

    /** Pretext terms common in credential phishing and ransomware droppers. */
    static final List<String> SUSPICIOUS_KEYWORDS = List.of(
            "verify", "update", "secure", "account", "login",
            "banking", "free", "gift", "urgent", "suspend",
            "encrypt", "decrypt", "download", "wallet", "crypto",
            "bitcoin", "password", "invoice", "payment", "support",
            "confirm", "unlock");

    /** Top-level domains with a disproportionate share of abuse reports. */
    static final Set<String> HIGH_RISK_TLDS = Set.of(
            "xyz", "top", "click", "site", "work", "loan",
            "ru", "cn", "tk", "pw", "cc", "ws", "info", "link",
            "date", "racing", "gq", "ml", "ga", "cf");

    /** Upper bound (exclusive) of the simulated domain age, roughly ten years. */
    static final int SIMULATED_AGE_RANGE_DAYS = 3650;

    private static final Pattern IPV4_PART = Pattern.compile("0x[0-9a-f]+|[0-9]+");

    /**
     * Extract all features from the given URL.
     *
     * @param url the raw URL as submitted; null is treated as empty
     * @return the features, never null
     */
    public UrlFeatures extract(String url) {
        String raw = url == null ? "" : url;
        ParsedUrl parsed = ParsedUrl.parse(raw);

        boolean ipHost = !parsed.parsable() || parsed.ipv6Literal() || isIpv4Literal(parsed.host());
        DomainParts domain = ipHost ? DomainParts.NONE : splitDomain(parsed.host());

        return new UrlFeatures(
                raw.codePointCount(0, raw.length()),
                countDots(raw),
                ipHost,
                countKeywords(raw),
                ipHost ? UrlFeatures.UNKNOWN_DOMAIN_AGE : simulatedDomainAge(domain.registrable()),
                HIGH_RISK_TLDS.contains(domain.tld()) ? 1.0 : 0.0,
                "https".equals(parsed.scheme()),
                domain.subdomainCount(),
                shannonEntropy(raw));
    }

    static int countDots(String url) {
        int dots = 0;
        for (int i = 0; i < url.length(); i++) {
            if (url.charAt(i) == '.') {
                dots++;
            }
        }
        return dots;
    }

    static int countKeywords(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        int count = 0;
        for (String keyword : SUSPICIOUS_KEYWORDS) {
            if (lower.contains(keyword)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Accepts every form {@code inet_aton} does: one to four parts, each decimal,
     * octal (leading zero) or hex ({@code 0x}).
     */
    static boolean isIpv4Literal(String host) {
        if (host.isEmpty()) {
            return false;
        }
        String[] parts = host.split("\\.", -1);
        if (parts.length > 4) {
            return false;
        }
        for (String part : parts) {
            if (!IPV4_PART.matcher(part).matches()) {
                return false;
            }
        }
        return true;
    }

    static double shannonEntropy(String url) {
        if (url.isEmpty()) {
            return 0.0;
        }
        Map<Integer, Integer> counts = new HashMap<>();
        url.codePoints().forEach(cp -> counts.merge(cp, 1, Integer::sum));
        double total = counts.values().stream().mapToInt(Integer::intValue).sum();

        double entropy = 0.0;
        for (int count : counts.values()) {
            double p = count / total;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    static int simulatedDomainAge(String registrableDomain) {
        int hash = Hashing.murmur3_32_fixed()
                .hashString(registrableDomain, StandardCharsets.UTF_8)
                .asInt();
        return Math.floorMod(hash, SIMULATED_AGE_RANGE_DAYS);
    }

    static DomainParts splitDomain(String host) {
        String[] labels = host.split("\\.");
        String tld = labels[labels.length - 1];
        if (InternetDomainName.isValid(host)) {
            InternetDomainName name = InternetDomainName.from(host);
            if (name.isUnderPublicSuffix()) {
                InternetDomainName registrable = name.topPrivateDomain();
                int subdomains = name.parts().size() - registrable.parts().size();
                return new DomainParts(registrable.toString(), tld, subdomains);
            }
            if (name.isPublicSuffix()) {
                return new DomainParts(host, tld, 0);
            }
        }
        // unknown suffix or invalid per RFC 1035: assume a single-label suffix
        int keep = Math.min(2, labels.length);
        String registrable = String.join(".",
                List.of(labels).subList(labels.length - keep, labels.length));
        return new DomainParts(registrable, tld, labels.length - keep);
    }

    record DomainParts(String registrable, String tld, int subdomainCount) {
        static final DomainParts NONE = new DomainParts("", "", 0);
    }
}
