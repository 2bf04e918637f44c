package com.craftsman.coordinator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under {@code craftsman.coordinator}.
 *
 * Depth and retry limits are policy defaults, not contracts; both can be
 * overridden per deployment.
 */
@Component
@ConfigurationProperties(prefix = "craftsman.coordinator")
public class CoordinatorProperties {

    private int maxDelegationDepth = 8;
    private int maxRetries = 0;
    private int maxConcurrency = 4;
    private Duration defaultTaskTimeout;
    private List<Role> roles = new ArrayList<>();
    private Map<String, ProtectedPaths> protectedPaths = new LinkedHashMap<>();

    public int getMaxDelegationDepth() { return maxDelegationDepth; }
    public void setMaxDelegationDepth(int maxDelegationDepth) { this.maxDelegationDepth = maxDelegationDepth; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public int getMaxConcurrency() { return maxConcurrency; }
    public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
    public Duration getDefaultTaskTimeout() { return defaultTaskTimeout; }
    public void setDefaultTaskTimeout(Duration defaultTaskTimeout) { this.defaultTaskTimeout = defaultTaskTimeout; }
    public List<Role> getRoles() { return roles; }
    public void setRoles(List<Role> roles) { this.roles = roles != null ? roles : new ArrayList<>(); }
    public Map<String, ProtectedPaths> getProtectedPaths() { return protectedPaths; }
    public void setProtectedPaths(Map<String, ProtectedPaths> protectedPaths) { this.protectedPaths = protectedPaths != null ? protectedPaths : new LinkedHashMap<>(); }

    /**
     * Paths a capability refuses even where its scope would accept them.
     * Keyed by capability name ("read-file"); the top-level table applies to
     * every role holding that capability, a role's own table adds to it.
     */
    public static class ProtectedPaths {
        private List<String> deny = new ArrayList<>();
        private List<String> except = new ArrayList<>();

        public List<String> getDeny() { return deny; }
        public void setDeny(List<String> deny) { this.deny = deny != null ? deny : new ArrayList<>(); }
        public List<String> getExcept() { return except; }
        public void setExcept(List<String> except) { this.except = except != null ? except : new ArrayList<>(); }
    }

    /**
     * One entry of the static role table.
     *
     * {@code pathScopes} keys are capability names ("write-file"); values are
     * the globs that capability is restricted to.
     */
    public static class Role {
        private String id;
        private String description = "";
        private List<String> capabilities = new ArrayList<>();
        private Map<String, List<String>> pathScopes = new LinkedHashMap<>();
        private Map<String, ProtectedPaths> protectedPaths = new LinkedHashMap<>();
        private Resource prompt;
        private int maxSteps = 50;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public List<String> getCapabilities() { return capabilities; }
        public void setCapabilities(List<String> capabilities) { this.capabilities = capabilities != null ? capabilities : new ArrayList<>(); }
        public Map<String, List<String>> getPathScopes() { return pathScopes; }
        public void setPathScopes(Map<String, List<String>> pathScopes) { this.pathScopes = pathScopes != null ? pathScopes : new LinkedHashMap<>(); }
        public Map<String, ProtectedPaths> getProtectedPaths() { return protectedPaths; }
        public void setProtectedPaths(Map<String, ProtectedPaths> protectedPaths) { this.protectedPaths = protectedPaths != null ? protectedPaths : new LinkedHashMap<>(); }
        public Resource getPrompt() { return prompt; }
        public void setPrompt(Resource prompt) { this.prompt = prompt; }
        public int getMaxSteps() { return maxSteps; }
        public void setMaxSteps(int maxSteps) { this.maxSteps = maxSteps; }
    }
}
