package com.earlywarning.analyzer.feature;

import java.net.IDN;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient split of a URL into scheme and host.
 *
 * <p>
 * {@link java.net.URI} rejects much of what phishing kits send (spaces,
 * unescaped brackets, bare hosts without a scheme), so the split is done by
 * hand and never throws. A host that cannot be recovered is reported as
 * unparsable rather than rejected.
 * </p>
 *
 * @param scheme      lower-cased scheme, empty when the URL has none
 * @param host        lower-cased ASCII host, empty when unparsable
 * @param parsable    whether a syntactically valid host was found
 * @param ipv6Literal host was given as a bracketed IPv6 literal
 *
 * @author Naveed Gung
 */
record ParsedUrl(String scheme, String host, boolean parsable, boolean ipv6Literal) {

    private static final Pattern SCHEME = Pattern.compile("^([A-Za-z][A-Za-z0-9+.\\-]*)://");
    private static final Pattern HOST = Pattern.compile("^[a-z0-9_\\-]+(\\.[a-z0-9_\\-]+)*$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-f:.]*:[0-9a-f:.]*(%.+)?$");

    static ParsedUrl parse(String url) {
        String rest = url == null ? "" : url.strip();
        String scheme = "";

        Matcher matcher = SCHEME.matcher(rest);
        if (matcher.find()) {
            scheme = matcher.group(1).toLowerCase(Locale.ROOT);
            rest = rest.substring(matcher.end());
        }

        String authority = rest.substring(0, authorityEnd(rest));
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }

        if (authority.startsWith("[")) {
            int close = authority.indexOf(']');
            if (close < 0) {
                return unparsable(scheme);
            }
            String literal = authority.substring(1, close).toLowerCase(Locale.ROOT);
            return IPV6.matcher(literal).matches()
                    ? new ParsedUrl(scheme, literal, true, true)
                    : unparsable(scheme);
        }

        int colon = authority.indexOf(':');
        if (colon >= 0) {
            authority = authority.substring(0, colon);
        }
        if (authority.endsWith(".")) {
            authority = authority.substring(0, authority.length() - 1);
        }

        String host = toAscii(authority);
        if (host == null || host.isEmpty() || !HOST.matcher(host).matches()) {
            return unparsable(scheme);
        }
        return new ParsedUrl(scheme, host, true, false);
    }

    private static int authorityEnd(String rest) {
        for (int i = 0; i < rest.length(); i++) {
            char c = rest.charAt(i);
            if (c == '/' || c == '?' || c == '#' || c == '\\') {
                return i;
            }
        }
        return rest.length();
    }

    /** Punycode-encode internationalized hosts; null when IDN conversion rejects the label. */
    private static String toAscii(String host) {
        try {
            return IDN.toASCII(host, IDN.ALLOW_UNASSIGNED).toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static ParsedUrl unparsable(String scheme) {
        return new ParsedUrl(scheme, "", false, false);
    }
}
