package io.routeflow.core.model;

import java.util.Objects;

/**
 * One user-authored transformer step.
 *
 * @param sequenceNumber execution order (ascending)
 * @param name           display name; also the channel map key for {@link StepType#MAPPER} steps
 * @param type           what happens with the step's result
 * @param lang           script engine id
 * @param script         script source
 * @param enabled        disabled steps are skipped entirely
 */
public record ScriptStep(int sequenceNumber, String name, StepType type, String lang, String script, boolean enabled) {

    /** Engine id used when a rule or step does not name one. */
    public static final String DEFAULT_LANG = "spel";

    public ScriptStep {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(script, "script must not be null");
        type = type != null ? type : StepType.SCRIPT;
        lang = lang != null ? lang : DEFAULT_LANG;
    }

    /** Enabled step in the default language. */
    public static ScriptStep of(int sequenceNumber, String name, StepType type, String script) {
        return new ScriptStep(sequenceNumber, name, type, DEFAULT_LANG, script, true);
    }

    public ScriptStep disabled() {
        return new ScriptStep(sequenceNumber, name, type, lang, script, false);
    }
}
