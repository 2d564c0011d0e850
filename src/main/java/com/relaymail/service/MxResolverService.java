package com.relaymail.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * MX lookup for direct delivery
 */
@Slf4j
@Service
public class MxResolverService {

    /**
     * MX hosts for the domain, lowest preference first. When the domain publishes no MX
     * records, or the lookup fails, the domain itself is the only host (RFC 5321 5.1).
     */
    public List<String> resolveMxHosts(String domain) {
        List<String> hosts = new ArrayList<>();
        try {
            Record[] records = lookupMx(domain);
            if (records != null) {
                List<MXRecord> mxRecords = new ArrayList<>();
                for (Record record : records) {
                    if (record instanceof MXRecord mx) {
                        mxRecords.add(mx);
                    }
                }
                mxRecords.sort(Comparator.comparingInt(MXRecord::getPriority));
                for (MXRecord mx : mxRecords) {
                    String host = mx.getTarget().toString(true);
                    if (!host.isEmpty() && !".".equals(host)) {
                        hosts.add(host);
                    }
                }
            }
        } catch (TextParseException | RuntimeException e) {
            log.warn("DNS query failed for domain {}: {}", domain, e.getMessage());
        }

        if (hosts.isEmpty()) {
            log.debug("No MX records found for {}, falling back to domain as host", domain);
            hosts.add(domain);
        } else {
            log.debug("Resolved {} MX records for {}: {}", hosts.size(), domain, hosts);
        }
        return hosts;
    }

    protected Record[] lookupMx(String domain) throws TextParseException {
        return new Lookup(domain, Type.MX).run();
    }
}
