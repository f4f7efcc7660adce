package com.flagship.smart_sync.rail;

import com.flagship.smart_sync.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up rails by id. Every {@link RailSyncService} bean is registered.
 */
@Component
@Slf4j
public class RailRegistry {

    private final Map<String, RailSyncService> rails = new LinkedHashMap<>();

    public RailRegistry(List<RailSyncService> services) {
        for (RailSyncService service : services) {
            RailSyncService previous = rails.putIfAbsent(service.railId(), service);
            if (previous != null) {
                throw new IllegalStateException("Duplicate rail id: " + service.railId());
            }
        }
        log.info("Registered rails: {}", rails.keySet());
    }

    public RailSyncService get(String railId) {
        RailSyncService rail = rails.get(railId);
        if (rail == null) {
            throw new NotFoundException("Unknown rail: " + railId);
        }
        return rail;
    }

    public boolean contains(String railId) {
        return rails.containsKey(railId);
    }

    public Collection<RailSyncService> all() {
        return Collections.unmodifiableCollection(rails.values());
    }
}
