package uk.gegc.unfurl.features.urlsafety.domain.model;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;

/**
 * A contiguous block of addresses in {@code address/prefixLength} notation.
 * IPv4 and IPv6 ranges never contain addresses of the other family.
 */
public record CidrRange(String notation, byte[] network, int prefixLength) {

    public CidrRange {
        network = network.clone();
    }

    public static CidrRange parse(String notation) {
        int slash = notation.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("CIDR notation must contain a prefix length: " + notation);
        }
        String address = notation.substring(0, slash);
        int prefixLength = Integer.parseInt(notation.substring(slash + 1));
        byte[] bytes;
        try {
            // literal only, getByName never hits DNS for numeric input
            bytes = InetAddress.getByName(address).getAddress();
        } catch (UnknownHostException ex) {
            throw new IllegalArgumentException("Invalid CIDR address: " + notation, ex);
        }
        if (prefixLength < 0 || prefixLength > bytes.length * 8) {
            throw new IllegalArgumentException("Invalid prefix length: " + notation);
        }
        return new CidrRange(notation, bytes, prefixLength);
    }

    public boolean contains(InetAddress address) {
        return contains(address.getAddress());
    }

    public boolean contains(byte[] candidate) {
        if (candidate.length != network.length) {
            return false;
        }
        int fullBytes = prefixLength / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (candidate[i] != network[i]) {
                return false;
            }
        }
        int remainingBits = prefixLength % 8;
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (candidate[fullBytes] & mask) == (network[fullBytes] & mask);
    }

    public boolean isIpv6() {
        return network.length == 16;
    }

    @Override
    public byte[] network() {
        return network.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CidrRange other)) return false;
        return prefixLength == other.prefixLength && Arrays.equals(network, other.network);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(network) + prefixLength;
    }

    @Override
    public String toString() {
        return notation;
    }
}
