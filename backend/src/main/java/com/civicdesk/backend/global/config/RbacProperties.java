package com.civicdesk.backend.global.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for the authorization engine, bound from the {@code rbac.*} namespace.
 */
@ConfigurationProperties(prefix = "rbac")
public class RbacProperties {

    /**
     * Role whose holders (and every role inheriting it) bypass permission checks.
     */
    private String topLevelRole = "superuser";

    /**
     * Header carrying the user id authenticated by the upstream gateway.
     */
    private String identityHeader = "X-Authenticated-User-Id";

    /**
     * Legacy role codes accepted on assignment and mapped onto current roles.
     */
    private Map<String, String> roleAliases = new HashMap<>(Map.of(
            "constituent", "registered_user",
            "member", "chapter_member"
    ));

    private final Cache cache = new Cache();
    private final Audit audit = new Audit();
    private final Overrides overrides = new Overrides();
    private final Locks locks = new Locks();

    public String getTopLevelRole() {
        return topLevelRole;
    }

    public void setTopLevelRole(String topLevelRole) {
        this.topLevelRole = topLevelRole;
    }

    public String getIdentityHeader() {
        return identityHeader;
    }

    public void setIdentityHeader(String identityHeader) {
        this.identityHeader = identityHeader;
    }

    public Map<String, String> getRoleAliases() {
        return roleAliases;
    }

    public void setRoleAliases(Map<String, String> roleAliases) {
        this.roleAliases = roleAliases;
    }

    public String resolveRoleAlias(String roleCode) {
        if (roleCode == null) {
            return null;
        }
        String normalized = roleCode.trim().toLowerCase(Locale.ROOT);
        return roleAliases.getOrDefault(normalized, normalized);
    }

    public Cache getCache() {
        return cache;
    }

    public Audit getAudit() {
        return audit;
    }

    public Overrides getOverrides() {
        return overrides;
    }

    public Locks getLocks() {
        return locks;
    }

    public static class Cache {

        /**
         * {@code in-memory} or {@code redis}.
         */
        private String backend = "in-memory";

        /**
         * Safety-net lifetime of a cached permission set; explicit invalidation is the primary mechanism.
         */
        private Duration ttl = Duration.ofMinutes(5);

        private String keyPrefix = "civicdesk:rbac:";

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    public static class Audit {

        private Duration retryInterval = Duration.ofSeconds(30);

        private int maxAttempts = 10;

        public Duration getRetryInterval() {
            return retryInterval;
        }

        public void setRetryInterval(Duration retryInterval) {
            this.retryInterval = retryInterval;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class Overrides {

        /**
         * How long an expired override row is kept before the housekeeping job deletes it.
         */
        private Duration purgeAfter = Duration.ofDays(30);

        private String purgeCron = "0 15 3 * * *";

        public String getPurgeCron() {
            return purgeCron;
        }

        public void setPurgeCron(String purgeCron) {
            this.purgeCron = purgeCron;
        }

        public Duration getPurgeAfter() {
            return purgeAfter;
        }

        public void setPurgeAfter(Duration purgeAfter) {
            this.purgeAfter = purgeAfter;
        }
    }

    public static class Locks {

        private Duration userTimeout = Duration.ofSeconds(5);

        public Duration getUserTimeout() {
            return userTimeout;
        }

        public void setUserTimeout(Duration userTimeout) {
            this.userTimeout = userTimeout;
        }
    }
}
