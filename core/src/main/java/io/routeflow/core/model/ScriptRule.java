package io.routeflow.core.model;

import java.util.Objects;

/**
 * One user-authored filter rule.
 *
 * @param sequenceNumber evaluation order (ascending)
 * @param name           display name, used in error reports
 * @param operator       how the result combines with the preceding rules
 * @param lang           script engine id
 * @param script         script source
 * @param enabled        disabled rules are skipped entirely
 */
public record ScriptRule(
        int sequenceNumber, String name, RuleOperator operator, String lang, String script, boolean enabled) {

    public ScriptRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(script, "script must not be null");
        operator = operator != null ? operator : RuleOperator.AND;
        lang = lang != null ? lang : ScriptStep.DEFAULT_LANG;
    }

    /** Enabled rule in the default language. */
    public static ScriptRule of(int sequenceNumber, String name, RuleOperator operator, String script) {
        return new ScriptRule(sequenceNumber, name, operator, ScriptStep.DEFAULT_LANG, script, true);
    }

    public ScriptRule disabled() {
        return new ScriptRule(sequenceNumber, name, operator, lang, script, false);
    }
}
