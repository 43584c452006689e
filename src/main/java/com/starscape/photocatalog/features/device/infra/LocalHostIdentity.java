package com.starscape.photocatalog.features.device.infra;

import com.starscape.photocatalog.features.device.domain.HostIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;

public class LocalHostIdentity implements HostIdentity {
    
    private static final Logger log = LoggerFactory.getLogger(LocalHostIdentity.class);
    private static final String FALLBACK = "local";
    
    @Override
    public String hostname() {
        String env = System.getenv("HOSTNAME");
        if (env != null && !env.isBlank()) {
            return env;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not determine hostname, using '{}': {}", FALLBACK, e.getMessage());
            return FALLBACK;
        }
    }
}
