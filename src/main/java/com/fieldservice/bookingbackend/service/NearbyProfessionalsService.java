package com.fieldservice.bookingbackend.service;

import com.fieldservice.bookingbackend.config.RedisConfig;
import com.fieldservice.bookingbackend.dto.NearbyProfessional;
import com.fieldservice.bookingbackend.dto.NearbySearchQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Cached nearby search. Entries expire by TTL only; position and status updates do not evict them,
 * so a result can be up to one TTL old.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NearbyProfessionalsService {

    private final ProfessionalProximityIndex proximityIndex;

    @Cacheable(value = RedisConfig.NEARBY_PROFESSIONALS_CACHE, key = "#query.cacheKey()")
    public List<NearbyProfessional> findNearby(NearbySearchQuery query) {
        log.debug("Cache miss for {}", query.cacheKey());
        return proximityIndex.findNearby(query);
    }
}
