package com.flagship.smart_sync.view;

import java.util.UUID;

/**
 * One downstream use case over the mirror.
 *
 * Implementations read only the mirror and their own workflow tables, never a rail,
 * so a view is reproducible from stored state and the clock alone.
 */
public interface DataOrchestrator<V> {

    String useCase();

    V getView(UUID tenantId);
}
