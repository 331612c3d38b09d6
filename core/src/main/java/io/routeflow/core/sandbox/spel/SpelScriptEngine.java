package io.routeflow.core.sandbox.spel;

import io.routeflow.core.error.ScriptCompileException;
import io.routeflow.core.error.ScriptRuntimeException;
import io.routeflow.core.sandbox.ScriptBindings;
import io.routeflow.core.spi.CompiledScript;
import io.routeflow.core.spi.ScriptEngine;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

/**
 * Spring Expression Language engine, the default script language of a channel.
 *
 * <p>Each binding is exposed as a SpEL variable ({@code #msg}, {@code #channelMap}, ...). Evaluation uses a
 * {@link SimpleEvaluationContext}: instance methods and property/map access work, but type references
 * ({@code T(...)}), constructors and bean references are unavailable, so a script only reaches what its bindings
 * hand it. Helper functions: {@code #uuid()}, {@code #regex_match(s, re)}, {@code #regex_extract(s, re, group)},
 * {@code #base64_encode(s)}, {@code #base64_decode(s)}.
 */
public final class SpelScriptEngine implements ScriptEngine {

    /** Engine identifier used in channel YAML {@code lang:} fields. */
    public static final String ENGINE_ID = "spel";

    private final ExpressionParser parser = new SpelExpressionParser();

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public CompiledScript compile(String source) {
        if (source == null || source.isBlank()) {
            throw new ScriptCompileException("SpEL script is empty", null);
        }
        try {
            return new SpelCompiledScript(parser.parseExpression(source));
        } catch (ParseException e) {
            throw new ScriptCompileException("Failed to compile SpEL script: " + e.getMessage(), e, null);
        }
    }

    /** Thread-safe compiled SpEL expression handle; a fresh evaluation context is built per call. */
    private static final class SpelCompiledScript implements CompiledScript {

        private final Expression expression;

        SpelCompiledScript(Expression expression) {
            this.expression = expression;
        }

        @Override
        public Object evaluate(ScriptBindings bindings) {
            SimpleEvaluationContext context = SimpleEvaluationContext.forReadWriteDataBinding()
                    .withInstanceMethods()
                    .build();
            SpelFunctions.register(context);
            bindings.asMap().forEach(context::setVariable);
            try {
                return expression.getValue(context);
            } catch (EvaluationException e) {
                throw new ScriptRuntimeException("SpEL evaluation failed: " + e.getMessage(), e, null);
            }
        }
    }
}
