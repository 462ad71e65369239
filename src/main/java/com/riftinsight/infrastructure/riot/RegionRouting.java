package com.riftinsight.infrastructure.riot;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps platform region codes (euw1, na1, kr, ...) to the regional routing values
 * used by the account and match services.
 */
public final class RegionRouting {

    private static final String DEFAULT_ROUTING = "europe";

    private static final Map<String, String> PLATFORM_TO_ROUTING = Map.ofEntries(
            Map.entry("euw1", "europe"), Map.entry("eun1", "europe"),
            Map.entry("tr1", "europe"), Map.entry("ru", "europe"),
            Map.entry("na1", "americas"), Map.entry("br1", "americas"),
            Map.entry("la1", "americas"), Map.entry("la2", "americas"),
            Map.entry("kr", "asia"), Map.entry("jp1", "asia"),
            Map.entry("oc1", "sea"), Map.entry("ph2", "sea"), Map.entry("sg2", "sea"),
            Map.entry("th2", "sea"), Map.entry("tw2", "sea"), Map.entry("vn2", "sea"));

    // Short codes users commonly type that need the numeric suffix
    private static final Set<String> NEEDS_SUFFIX = Set.of("euw", "eun", "na", "br", "la", "tr", "jp", "oc");

    private RegionRouting() {
    }

    /**
     * Canonical platform code: lower-cased, "euw" becomes "euw1".
     */
    public static String normalizePlatform(String region) {
        String platform = region == null ? "" : region.trim().toLowerCase(Locale.ROOT);
        if (NEEDS_SUFFIX.contains(platform)) {
            return platform + "1";
        }
        return platform;
    }

    /**
     * Regional routing for match-v5 lookups. Unknown platforms fall back to europe.
     */
    public static String regionalRouting(String region) {
        return PLATFORM_TO_ROUTING.getOrDefault(normalizePlatform(region), DEFAULT_ROUTING);
    }

    /**
     * Regional routing for account-v1, which is not served from the sea cluster.
     */
    public static String accountRouting(String region) {
        String routing = regionalRouting(region);
        return "sea".equals(routing) ? "asia" : routing;
    }
}
