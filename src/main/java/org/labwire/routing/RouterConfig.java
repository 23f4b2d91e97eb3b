package org.labwire.routing;

import lombok.Builder;
import lombok.Value;

/**
 * Search bounds and start-up behavior of a {@link Router}.
 *
 * <p>Non-positive bounds mean unbounded.</p>
 */
@Value
@Builder
public class RouterConfig {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    static final String PROP_MAX_PATHS_PER_PAIR = "labwire.routing.maxPathsPerPair";
    static final String PROP_MAX_SOURCE_CANDIDATES = "labwire.routing.maxSourceCandidates";

    /**
     * Maximum number of simple paths enumerated from one source to one terminal.
     */
    @Builder.Default
    int maxPathsPerPair = UNBOUNDED;

    /**
     * Maximum number of source combinations handed to the appraiser per route request.
     */
    @Builder.Default
    int maxSourceCandidates = UNBOUNDED;

    /**
     * Whether dynamic-source nodes are connected to their eligible sources when the router is built.
     */
    @Builder.Default
    boolean connectDynamicSources = true;

    /**
     * Unbounded search with dynamic-source connection; bounds may be set through the
     * {@code labwire.routing.maxPathsPerPair} and {@code labwire.routing.maxSourceCandidates}
     * system properties.
     */
    public static RouterConfig defaults() {
        return RouterConfig.builder()
                .maxPathsPerPair(readBound(PROP_MAX_PATHS_PER_PAIR))
                .maxSourceCandidates(readBound(PROP_MAX_SOURCE_CANDIDATES))
                .build();
    }

    int pathsPerPairBound() {
        return normalizeBound(maxPathsPerPair);
    }

    int sourceCandidateBound() {
        return normalizeBound(maxSourceCandidates);
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return normalizeBound(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }
}
