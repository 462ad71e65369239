package com.riftinsight.domain.service;

import com.riftinsight.infrastructure.riot.UpstreamGateway;
import com.riftinsight.infrastructure.riot.UpstreamResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Data Dragon patch version used by clients to build asset URLs.
 *
 * A pinned version (DDRAGON_VERSION) wins unless it is "latest". Otherwise the
 * gateway's cached versions list is used, with a fixed fallback when that fails.
 */
@Slf4j
@Service
public class StaticDataService {

    static final String FALLBACK_VERSION = "14.24.1";

    private final UpstreamGateway gateway;
    private final String pinnedVersion;

    public StaticDataService(
            UpstreamGateway gateway,
            @Value("${app.ddragon.version:latest}") String pinnedVersion) {
        this.gateway = gateway;
        this.pinnedVersion = pinnedVersion == null ? "" : pinnedVersion.trim();
    }

    public String currentVersion() {
        if (!pinnedVersion.isEmpty() && !"latest".equalsIgnoreCase(pinnedVersion)) {
            return pinnedVersion;
        }
        UpstreamResult<String> latest = gateway.latestStaticVersion();
        if (latest.isFound()) {
            return latest.orElse(FALLBACK_VERSION);
        }
        log.warn("Failed to fetch Data Dragon version; using fallback={} ({})", FALLBACK_VERSION, latest);
        return FALLBACK_VERSION;
    }
}
