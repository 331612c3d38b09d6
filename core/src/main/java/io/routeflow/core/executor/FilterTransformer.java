package io.routeflow.core.executor;

import io.routeflow.core.model.ScriptRule;
import io.routeflow.core.model.ScriptStep;
import java.util.Comparator;
import java.util.List;

/**
 * Filter and transformer configuration of one connector. Rules and steps are kept sorted by sequence number.
 *
 * @param preprocessor     optional script run before filtering, may be null
 * @param rules            filter rules
 * @param steps            transformer steps
 * @param inboundDataType  data type of the connector's input (e.g. {@code HL7V2})
 * @param outboundDataType data type of the connector's output
 */
public record FilterTransformer(
        ScriptStep preprocessor,
        List<ScriptRule> rules,
        List<ScriptStep> steps,
        String inboundDataType,
        String outboundDataType) {

    /** Data type assumed when none is configured. */
    public static final String DEFAULT_DATA_TYPE = "XML";

    public FilterTransformer {
        rules = rules == null
                ? List.of()
                : rules.stream()
                        .sorted(Comparator.comparingInt(ScriptRule::sequenceNumber))
                        .toList();
        steps = steps == null
                ? List.of()
                : steps.stream()
                        .sorted(Comparator.comparingInt(ScriptStep::sequenceNumber))
                        .toList();
        inboundDataType = inboundDataType != null ? inboundDataType : DEFAULT_DATA_TYPE;
        outboundDataType = outboundDataType != null ? outboundDataType : inboundDataType;
    }

    /** No preprocessor, rules or steps; content passes through unchanged. */
    public static FilterTransformer passthrough() {
        return new FilterTransformer(null, List.of(), List.of(), null, null);
    }

    public static FilterTransformer of(List<ScriptRule> rules, List<ScriptStep> steps) {
        return new FilterTransformer(null, rules, steps, null, null);
    }
}
