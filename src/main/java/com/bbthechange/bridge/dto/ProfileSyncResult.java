package com.bbthechange.bridge.dto;

import com.bbthechange.bridge.model.Puppet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one profile sync. The puppet is always returned, possibly partially updated;
 * {@code failures} lists what went wrong without aborting the sync.
 */
public record ProfileSyncResult(Puppet puppet,
                                boolean registeredChanged,
                                boolean nameChanged,
                                boolean avatarChanged,
                                boolean saved,
                                List<Exception> failures) {

    public ProfileSyncResult {
        failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    public static ProfileSyncResult unchanged(Puppet puppet) {
        return new ProfileSyncResult(puppet, false, false, false, false, List.of());
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    public boolean isChanged() {
        return registeredChanged || nameChanged || avatarChanged;
    }
}
