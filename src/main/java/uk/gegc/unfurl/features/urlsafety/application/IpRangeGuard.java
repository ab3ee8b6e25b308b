package uk.gegc.unfurl.features.urlsafety.application;

import org.springframework.stereotype.Component;
import uk.gegc.unfurl.features.urlsafety.domain.model.CidrRange;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Decides whether a resolved address falls inside a network range that outbound requests must
 * never reach: private networks, loopback, link-local (including cloud metadata endpoints) and
 * their IPv6 equivalents.
 */
@Component
public class IpRangeGuard {

    private static final List<CidrRange> BLOCKED_RANGES = Stream.of(
            // IPv4
            "10.0.0.0/8",
            "172.16.0.0/12",
            "192.168.0.0/16",
            "127.0.0.0/8",
            "169.254.0.0/16",
            "0.0.0.0/8",
            // IPv6
            "::1/128",
            "fc00::/7",
            "fe80::/10",
            "::/128"
    ).map(CidrRange::parse).toList();

    public boolean isBlocked(InetAddress address) {
        return findBlockingRange(address).isPresent();
    }

    /**
     * Returns the first blocked range containing the address.
     * IPv4-mapped IPv6 addresses ({@code ::ffff:a.b.c.d}) are checked as the IPv4 address they carry.
     */
    public Optional<CidrRange> findBlockingRange(InetAddress address) {
        byte[] bytes = unwrapMappedIpv4(address);
        for (CidrRange range : BLOCKED_RANGES) {
            if (range.contains(bytes)) {
                return Optional.of(range);
            }
        }
        return Optional.empty();
    }

    public List<CidrRange> blockedRanges() {
        return BLOCKED_RANGES;
    }

    private byte[] unwrapMappedIpv4(InetAddress address) {
        byte[] bytes = address.getAddress();
        if (!(address instanceof Inet6Address) || bytes.length != 16) {
            return bytes;
        }
        for (int i = 0; i < 10; i++) {
            if (bytes[i] != 0) {
                return bytes;
            }
        }
        if ((bytes[10] & 0xFF) != 0xFF || (bytes[11] & 0xFF) != 0xFF) {
            return bytes;
        }
        return Arrays.copyOfRange(bytes, 12, 16);
    }
}
