package com.civicdesk.backend.modules.override.application;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.civicdesk.backend.modules.authorization.domain.OverridePolarity;
import com.civicdesk.backend.modules.override.domain.PermissionOverride;

public record OverrideView(
        UUID userId,
        String codename,
        OverridePolarity polarity,
        String reason,
        OffsetDateTime expiresAt,
        UUID createdBy,
        boolean effective
) {

    public static OverrideView of(PermissionOverride override, OffsetDateTime now) {
        return new OverrideView(
                override.getUser().getId(),
                override.getPermission().getCodename(),
                override.getPolarity(),
                override.getReason(),
                override.getExpiresAt(),
                override.getCreatedBy(),
                override.isEffectiveAt(now)
        );
    }

    Map<String, Object> toAuditState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("userId", userId.toString());
        state.put("codename", codename);
        state.put("polarity", polarity.name());
        state.put("reason", reason);
        state.put("expiresAt", expiresAt == null ? null : expiresAt.toString());
        return state;
    }
}
