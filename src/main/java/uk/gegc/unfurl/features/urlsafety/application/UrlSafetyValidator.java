package uk.gegc.unfurl.features.urlsafety.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.unfurl.features.urlsafety.config.UrlSafetyProperties;
import uk.gegc.unfurl.features.urlsafety.domain.SsrfProtectionException;
import uk.gegc.unfurl.features.urlsafety.domain.model.CidrRange;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pre-flight check for any URL the service is about to request.
 *
 * <p>Checks run in a fixed order and the first violation wins:
 * <ol>
 *   <li>non-blank and at most {@code unfurl.safety.max-url-length} characters</li>
 *   <li>scheme is {@code http} or {@code https}, checked on the raw string before URI parsing</li>
 *   <li>the parsed URI has a host</li>
 *   <li>the host is an IP literal or resolves through {@link HostResolver}</li>
 *   <li>no resolved address lies in a range blocked by {@link IpRangeGuard}</li>
 * </ol>
 *
 * <p>DNS is queried on every call so a hostname validated earlier cannot be rebound to an
 * internal address later.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UrlSafetyValidator {

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");
    private static final Pattern HTTP_PREFIX = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);
    private static final Pattern IPV4_LITERAL = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");
    private static final int MAX_SCHEME_LENGTH = 20;

    private final UrlSafetyProperties properties;
    private final HostResolver hostResolver;
    private final IpRangeGuard ipRangeGuard;

    /**
     * Validates an outbound URL.
     *
     * @param url candidate URL
     * @throws SsrfProtectionException if any check fails
     */
    public void validate(String url) {
        if (url == null || url.isBlank()) {
            throw new SsrfProtectionException("Invalid URL format: URL is empty");
        }
        if (url.length() > properties.getMaxUrlLength()) {
            throw new SsrfProtectionException(
                    "URL too long (max " + properties.getMaxUrlLength() + " characters)");
        }

        checkRawScheme(url);
        URI uri = parse(url);

        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new SsrfProtectionException("Invalid URL format: URL must have a valid host");
        }

        for (InetAddress address : resolve(host)) {
            Optional<CidrRange> blocking = ipRangeGuard.findBlockingRange(address);
            if (blocking.isPresent()) {
                log.warn("Blocked outbound URL host={} address={} range={}",
                        host, address.getHostAddress(), blocking.get());
                throw new SsrfProtectionException(
                        "SSRF protection: private IP address blocked: " + address.getHostAddress());
            }
        }
    }

    /**
     * Same checks as {@link #validate(String)}, reported as a boolean.
     */
    public boolean isSafe(String url) {
        try {
            validate(url);
            return true;
        } catch (SsrfProtectionException ex) {
            log.debug("URL rejected by safety gate: {}", ex.getMessage());
            return false;
        }
    }

    private void checkRawScheme(String url) {
        int colon = url.indexOf(':');
        if (colon >= 0 && colon < MAX_SCHEME_LENGTH) {
            String scheme = url.substring(0, colon).toLowerCase(Locale.ROOT);
            if (!ALLOWED_SCHEMES.contains(scheme)) {
                throw new SsrfProtectionException("Invalid URL scheme (must be HTTP/HTTPS): " + scheme);
            }
        }
        if (!HTTP_PREFIX.matcher(url).find()) {
            throw new SsrfProtectionException("Invalid URL format: Could not parse URL");
        }
    }

    private URI parse(String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || !ALLOWED_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
                throw new SsrfProtectionException("Invalid URL scheme (must be HTTP/HTTPS): " + scheme);
            }
            return uri;
        } catch (URISyntaxException ex) {
            throw new SsrfProtectionException("Invalid URL format: " + ex.getMessage(), ex);
        }
    }

    private List<InetAddress> resolve(String host) {
        String literal = host;
        if (literal.startsWith("[") && literal.endsWith("]")) {
            literal = literal.substring(1, literal.length() - 1);
            if (!literal.contains(":")) {
                throw new SsrfProtectionException("Invalid IPv6 address: " + literal);
            }
        }

        if (IPV4_LITERAL.matcher(literal).matches() || literal.contains(":")) {
            if (!literal.contains(":") && !hasValidOctets(literal)) {
                throw new SsrfProtectionException("Invalid IP address: " + literal);
            }
            try {
                return List.of(InetAddress.getByName(literal));
            } catch (UnknownHostException ex) {
                throw new SsrfProtectionException("Invalid IP address: " + literal, ex);
            }
        }

        List<InetAddress> addresses;
        try {
            addresses = hostResolver.resolve(literal);
        } catch (UnknownHostException ex) {
            throw new SsrfProtectionException("Could not resolve hostname: " + host, ex);
        }
        if (addresses == null || addresses.isEmpty()) {
            throw new SsrfProtectionException("Could not resolve hostname: " + host);
        }
        return addresses;
    }

    private boolean hasValidOctets(String ipv4) {
        for (String octet : ipv4.split("\\.")) {
            if (Integer.parseInt(octet) > 255) {
                return false;
            }
        }
        return true;
    }
}
