package com.z254.swarm.hive.cache;

import com.z254.swarm.hive.config.SwarmProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Capacity and dedup settings of a {@link MessageCache}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachePolicy {

    @Builder.Default
    private int capacity = 256;

    @Builder.Default
    private boolean dedupEnabled = false;

    /**
     * Keywords dedup applies to. Empty means all keywords.
     */
    @Builder.Default
    private Set<String> dedupKeywords = Set.of();

    public boolean dedupApplies(String keyword) {
        return dedupKeywords == null || dedupKeywords.isEmpty() || dedupKeywords.contains(keyword);
    }

    public static CachePolicy from(SwarmProperties.CacheProperties properties) {
        return CachePolicy.builder()
                .capacity(Math.max(1, properties.getCapacity()))
                .dedupEnabled(properties.isDedupEnabled())
                .dedupKeywords(Set.copyOf(properties.getDedupKeywords()))
                .build();
    }
}
