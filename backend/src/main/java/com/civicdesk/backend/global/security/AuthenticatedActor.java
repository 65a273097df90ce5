package com.civicdesk.backend.global.security;

import java.util.UUID;

public record AuthenticatedActor(UUID userId) {
}
