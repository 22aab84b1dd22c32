package com.prudhvi.event_stream.capability;

/**
 * Attribute constraints attached to a capability rule.
 *
 * secretPath  — Ant-style glob the record's path must match; null means only the root path "/"
 * environment — exact environment slug the record must carry; null means any environment
 */
public record RuleConditions(String secretPath, String environment) {

    public static RuleConditions anyPathIn(String environment) {
        return new RuleConditions("/**", environment);
    }
}
