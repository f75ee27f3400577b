package com.webanalytics.funnel.store;

import com.webanalytics.funnel.model.FunnelDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of funnel definitions. Soft-deleted definitions are never returned.
 */
public interface FunnelDefinitionStore {

    Optional<FunnelDefinition> findActive(String websiteId, String funnelId);

    List<FunnelDefinition> listActive(String websiteId);

    /**
     * Store a new definition, assigning its id and timestamps.
     */
    FunnelDefinition create(FunnelDefinition definition);

    /**
     * @return false if no active definition matched
     */
    boolean softDelete(String websiteId, String funnelId);
}
