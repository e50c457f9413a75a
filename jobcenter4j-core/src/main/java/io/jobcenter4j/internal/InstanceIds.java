package io.jobcenter4j.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

final class InstanceIds {
    private static final Logger log = LoggerFactory.getLogger(InstanceIds.class);

    private InstanceIds() {
    }

    /**
     * Configured id, or {@code host-pid-uuid} truncated to 128 characters.
     */
    static String resolve(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }

        String host = "jobcenter4j";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("jobcenter could not resolve local host name msg={}", e.getMessage());
        }

        String pid = String.valueOf(ManagementFactory.getRuntimeMXBean().getPid());

        String generated = host + "-" + pid + "-" + UUID.randomUUID();
        return generated.length() > 128 ? generated.substring(0, 128) : generated;
    }
}
