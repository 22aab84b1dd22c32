package com.prudhvi.event_stream.capability;

import com.prudhvi.event_stream.event.EventName;
import com.prudhvi.event_stream.event.EventRecord;
import com.prudhvi.event_stream.event.ScopeType;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;

import java.util.List;

/**
 * Compiled form of a list of {@link CapabilityRule}s.
 *
 * A record is allowed when ANY rule matches it; a rule matches when ALL of its parts do:
 * subject equals the scope type, action equals the event name, the record's path matches
 * the rule's glob (root only when the rule has none), and the environment matches when the
 * rule names one.
 *
 * Globs use Ant-style syntax: "*" is one path segment, "**" is any depth, "?" one character.
 * Example: "/app/**" matches "/app", "/app/db" and "/app/db/replica".
 *
 * Instances are immutable and hold no locks; they are shared freely between the
 * event-delivery threads.
 */
public final class CapabilityMatcher {

    static final String ROOT_PATH = "/";

    // AntPathMatcher is stateless apart from an internal pattern cache, which is thread-safe.
    private static final PathMatcher PATHS = new AntPathMatcher("/");

    private static final CapabilityMatcher NONE = new CapabilityMatcher(List.of());

    private final List<CompiledRule> rules;

    private CapabilityMatcher(List<CompiledRule> rules) {
        this.rules = rules;
    }

    public static CapabilityMatcher compile(List<CapabilityRule> rules) {
        if (rules == null || rules.isEmpty()) {
            return NONE;
        }
        return new CapabilityMatcher(rules.stream().map(CompiledRule::of).toList());
    }

    /** A matcher that allows nothing. */
    public static CapabilityMatcher none() {
        return NONE;
    }

    public boolean allows(ScopeType scopeType, EventName eventName, EventRecord record) {
        for (CompiledRule rule : rules) {
            if (rule.matches(scopeType, eventName, record)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the records that pass, in their original order. Failing records are dropped
     * individually; the result is empty when none pass.
     */
    public List<EventRecord> filter(ScopeType scopeType, EventName eventName, List<EventRecord> records) {
        return records.stream()
                .filter(record -> allows(scopeType, eventName, record))
                .toList();
    }

    public int size() {
        return rules.size();
    }

    static String normalizePath(String path) {
        if (path == null || path.isBlank()) {
            return ROOT_PATH;
        }
        String normalized = path.startsWith("/") ? path : "/" + path;
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private record CompiledRule(ScopeType subject, EventName action, String pathPattern, String environment) {

        static CompiledRule of(CapabilityRule rule) {
            RuleConditions conditions = rule.conditions();
            String pattern = conditions == null || conditions.secretPath() == null
                    ? ROOT_PATH
                    : normalizePath(conditions.secretPath());
            String environment = conditions == null ? null : conditions.environment();
            return new CompiledRule(rule.subject(), rule.action(), pattern, environment);
        }

        boolean matches(ScopeType scopeType, EventName eventName, EventRecord record) {
            if (subject != scopeType || action != eventName) {
                return false;
            }
            if (environment != null && !environment.equals(record.environment())) {
                return false;
            }
            return PATHS.match(pathPattern, normalizePath(record.secretPath()));
        }
    }
}
