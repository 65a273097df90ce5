package com.civicdesk.backend.modules.override.presentation;

import java.util.List;
import java.util.UUID;

import com.civicdesk.backend.global.security.SecurityUtils;
import com.civicdesk.backend.modules.override.application.OverrideService;
import com.civicdesk.backend.modules.override.presentation.dto.OverrideRequest;
import com.civicdesk.backend.modules.override.presentation.dto.OverrideResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/rbac/users/{userId}/overrides")
@Tag(name = "Override Admin", description = "Per-user permission overrides")
public class OverrideAdminController {

    private final OverrideService overrideService;

    public OverrideAdminController(OverrideService overrideService) {
        this.overrideService = overrideService;
    }

    @GetMapping
    @Operation(summary = "List overrides of a user, expired ones included")
    @PreAuthorize("@permissionGuard.has('manage_overrides')")
    public ResponseEntity<List<OverrideResponse>> list(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(overrideService.list(userId).stream().map(OverrideResponse::from).toList());
    }

    @PutMapping("/{codename}")
    @Operation(summary = "Create or replace an override")
    @PreAuthorize("@permissionGuard.has('manage_overrides')")
    public ResponseEntity<OverrideResponse> put(@PathVariable("userId") UUID userId,
                                                @PathVariable("codename") String codename,
                                                @Valid @RequestBody OverrideRequest request) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(OverrideResponse.from(overrideService.createOrReplace(actorId, userId, codename,
                request.polarity(), request.reason(), request.expiresAt())));
    }

    @DeleteMapping("/{codename}")
    @Operation(summary = "Remove an override")
    @PreAuthorize("@permissionGuard.has('manage_overrides')")
    public ResponseEntity<Void> remove(@PathVariable("userId") UUID userId,
                                       @PathVariable("codename") String codename) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        overrideService.remove(actorId, userId, codename);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{codename}/expire")
    @Operation(summary = "Expire an override immediately")
    @PreAuthorize("@permissionGuard.has('manage_overrides')")
    public ResponseEntity<OverrideResponse> expire(@PathVariable("userId") UUID userId,
                                                   @PathVariable("codename") String codename) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(OverrideResponse.from(overrideService.expire(actorId, userId, codename)));
    }
}
