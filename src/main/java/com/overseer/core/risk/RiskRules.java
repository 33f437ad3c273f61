package com.overseer.core.risk;

import com.overseer.core.config.OverseerProperties;
import com.overseer.core.model.KeywordMatcher;
import com.overseer.core.model.TaskDescriptor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keyword tables behind the risk decision tree. Matching is word-bounded and applies to the
 * task description together with its resource paths, so {@code config/credentials.yml}
 * counts as a credential change.
 */
public final class RiskRules {

    static final List<String> DEFAULT_IRREVERSIBLE = List.of(
            "credential", "credentials", "secret", "secrets", "signing", "private key",
            "payment", "payments", "billing", "pii", "gdpr", "hipaa", "irreversible",
            "purge", "drop table", "truncate table", "production data", "data migration",
            "without rollback", "no rollback");

    static final List<String> DEFAULT_SECURITY = List.of(
            "security", "auth", "authentication", "authorization", "password", "token", "tokens",
            "permission", "permissions", "encryption", "privacy", "cookie", "csrf", "xss",
            "injection", "sanitize", "schema", "database", "migration", "integrity", "admin");

    static final List<String> DEFAULT_USER_VISIBLE = List.of(
            "feature", "behavior", "behaviour", "endpoint", "api", "ux", "redesign", "layout",
            "response format", "default", "rename", "workflow");

    static final List<String> DEFAULT_MULTI_MODULE = List.of(
            "across modules", "all modules", "every module", "system-wide", "cross-cutting", "entire codebase");

    private final List<String> irreversible;
    private final List<String> security;
    private final List<String> userVisible;
    private final List<String> multiModule;

    public RiskRules(List<String> irreversible, List<String> security,
                     List<String> userVisible, List<String> multiModule) {
        this.irreversible = List.copyOf(irreversible);
        this.security = List.copyOf(security);
        this.userVisible = List.copyOf(userVisible);
        this.multiModule = List.copyOf(multiModule);
    }

    public static RiskRules defaults() {
        return new RiskRules(DEFAULT_IRREVERSIBLE, DEFAULT_SECURITY, DEFAULT_USER_VISIBLE, DEFAULT_MULTI_MODULE);
    }

    public static RiskRules from(OverseerProperties.Risk overrides) {
        return new RiskRules(
                orDefault(overrides.getIrreversibleKeywords(), DEFAULT_IRREVERSIBLE),
                orDefault(overrides.getSecurityKeywords(), DEFAULT_SECURITY),
                orDefault(overrides.getUserVisibleKeywords(), DEFAULT_USER_VISIBLE),
                orDefault(overrides.getMultiModuleKeywords(), DEFAULT_MULTI_MODULE));
    }

    public List<String> irreversibleMatches(TaskDescriptor descriptor) {
        return KeywordMatcher.matching(text(descriptor), irreversible);
    }

    public List<String> securityMatches(TaskDescriptor descriptor) {
        return KeywordMatcher.matching(text(descriptor), security);
    }

    public List<String> userVisibleMatches(TaskDescriptor descriptor) {
        return KeywordMatcher.matching(descriptor.description(), userVisible);
    }

    public boolean spansModules(TaskDescriptor descriptor) {
        return modules(descriptor.resources()).size() > 1
                || KeywordMatcher.containsAny(descriptor.description(), multiModule);
    }

    public List<String> securityKeywords() {
        return security;
    }

    /**
     * Top-level module of each resource: its first path segment, or "." for root-level files.
     */
    static Set<String> modules(List<String> resources) {
        var modules = new LinkedHashSet<String>();
        for (String resource : resources) {
            String path = resource.replace('\\', '/');
            if (path.startsWith("./")) {
                path = path.substring(2);
            }
            if (path.startsWith("/")) {
                path = path.substring(1);
            }
            int slash = path.indexOf('/');
            modules.add(slash > 0 ? path.substring(0, slash) : ".");
        }
        return modules;
    }

    private static String text(TaskDescriptor descriptor) {
        return descriptor.description() + " " + String.join(" ", descriptor.resources());
    }

    private static List<String> orDefault(List<String> configured, List<String> fallback) {
        return configured == null || configured.isEmpty() ? fallback : configured;
    }
}
