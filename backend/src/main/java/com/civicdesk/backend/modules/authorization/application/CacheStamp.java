package com.civicdesk.backend.modules.authorization.application;

/**
 * Committed versions observed before computing a permission set. A cached entry is served only
 * while both still match.
 */
public record CacheStamp(long catalogVersion, long userVersion) {
}
