package uk.gegc.unfurl.features.urlsafety.application;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

/**
 * Resolves a hostname to the addresses an outbound request would connect to.
 * Implementations must not cache results between calls.
 */
public interface HostResolver {

    List<InetAddress> resolve(String host) throws UnknownHostException;
}
