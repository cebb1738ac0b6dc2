package com.demo.underwriting.service.profile;

import com.demo.underwriting.model.Platform;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Stand-in used while {@code profileSearch.enabled=false}. */
@Component
@ConditionalOnProperty(name = "profileSearch.enabled", havingValue = "false", matchIfMissing = true)
public class DisabledProfileSearch implements ProfileSearchPort {

    @Override
    public String search(Platform platform, String identifier) throws ProfileSearchException {
        throw new ProfileSearchException("profile search is disabled");
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
