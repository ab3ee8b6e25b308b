package uk.gegc.unfurl.features.urlsafety.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.unfurl.features.urlsafety.application.HostResolver;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

@Component
@Slf4j
public class DnsHostResolver implements HostResolver {

    @Override
    public List<InetAddress> resolve(String host) throws UnknownHostException {
        InetAddress[] addresses = InetAddress.getAllByName(host);
        log.debug("Resolved host {} to {} address(es)", host, addresses.length);
        return List.of(addresses);
    }
}
