package com.webanalytics.funnel.store;

import com.webanalytics.funnel.model.Website;

import java.util.Optional;

/**
 * Website id to domain lookup.
 */
public interface WebsiteStore {

    Optional<Website> findById(String websiteId);

    Website save(Website website);
}
