package io.routeflow.core.sandbox.jslt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.schibsted.spt.data.jslt.Expression;
import com.schibsted.spt.data.jslt.JsltException;
import com.schibsted.spt.data.jslt.Parser;
import io.routeflow.core.error.ScriptCompileException;
import io.routeflow.core.error.ScriptRuntimeException;
import io.routeflow.core.sandbox.ScriptBindings;
import io.routeflow.core.spi.CompiledScript;
import io.routeflow.core.spi.ScriptEngine;
import java.util.HashMap;
import java.util.Map;

/**
 * JSLT script engine for channels whose messages are JSON. Uses the Schibsted JSLT library to compile and evaluate
 * JSON-to-JSON transforms.
 *
 * <p>The {@code msg} binding is the input document ({@code .}); when it is not valid JSON it is passed as a JSON
 * string. Every binding Jackson can represent as JSON is also available as an external variable ({@code $channelMap},
 * {@code $message}, ...). The result is returned as a plain Java value.
 */
public final class JsltScriptEngine implements ScriptEngine {

    /** Engine identifier used in channel YAML {@code lang:} fields. */
    public static final String ENGINE_ID = "jslt";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public CompiledScript compile(String source) {
        try {
            return new JsltCompiledScript(Parser.compileString(source));
        } catch (JsltException e) {
            throw new ScriptCompileException("Failed to compile JSLT script: " + e.getMessage(), e, null);
        }
    }

    /** Thread-safe compiled JSLT expression handle. */
    private static final class JsltCompiledScript implements CompiledScript {

        private final Expression jsltExpression;

        JsltCompiledScript(Expression jsltExpression) {
            this.jsltExpression = jsltExpression;
        }

        @Override
        public Object evaluate(ScriptBindings bindings) {
            JsonNode output;
            try {
                output = jsltExpression.apply(buildVariables(bindings), input(bindings.get("msg")));
            } catch (JsltException e) {
                throw new ScriptRuntimeException("JSLT evaluation failed: " + e.getMessage(), e, null);
            }
            return toJava(output);
        }

        private static JsonNode input(Object msg) {
            if (msg == null) {
                return NullNode.getInstance();
            }
            String text = msg.toString();
            try {
                return MAPPER.readTree(text);
            } catch (JsonProcessingException e) {
                return TextNode.valueOf(text);
            }
        }

        /** Bindings Jackson cannot represent (e.g. a batch reader) are left out. */
        private static Map<String, JsonNode> buildVariables(ScriptBindings bindings) {
            Map<String, JsonNode> vars = new HashMap<>();
            bindings.asMap().forEach((name, value) -> {
                try {
                    vars.put(name, MAPPER.valueToTree(value));
                } catch (IllegalArgumentException e) {
                    vars.put(name, NullNode.getInstance());
                }
            });
            return vars;
        }

        private static Object toJava(JsonNode node) {
            if (node == null || node.isNull() || node.isMissingNode()) {
                return null;
            }
            try {
                return MAPPER.treeToValue(node, Object.class);
            } catch (JsonProcessingException e) {
                throw new ScriptRuntimeException("JSLT result could not be converted: " + e.getMessage(), e, null);
            }
        }
    }
}
