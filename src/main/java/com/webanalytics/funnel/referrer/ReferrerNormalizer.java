package com.webanalytics.funnel.referrer;

import com.webanalytics.funnel.model.ReferrerIdentity;

/**
 * Maps a raw referrer string to a canonical traffic source.
 * Implementations must be pure: the same input always yields the same identity.
 */
public interface ReferrerNormalizer {

    ReferrerIdentity normalize(String rawReferrer);
}
