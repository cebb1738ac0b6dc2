package com.demo.underwriting.service.profile;

import com.demo.underwriting.model.Platform;

/** External free-text profile search, addressed by platform + identifier. */
public interface ProfileSearchPort {

    /**
     * @return the narrative the search capability produced for this profile
     * @throws ProfileSearchException when the capability is unreachable, not
     *         configured, or answers with something unusable
     */
    String search(Platform platform, String identifier) throws ProfileSearchException;

    /** False when the capability is switched off; the collector then skips every lookup. */
    default boolean isEnabled() {
        return true;
    }
}
