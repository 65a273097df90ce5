package com.civicdesk.backend.modules.authorization.domain;

import java.time.OffsetDateTime;

public record OverrideEntry(String codename, OverridePolarity polarity, OffsetDateTime expiresAt) {

    public boolean isEffectiveAt(OffsetDateTime now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
