package io.routeflow.core.sandbox.spel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.routeflow.core.error.ScriptCompileException;
import io.routeflow.core.error.ScriptRuntimeException;
import io.routeflow.core.sandbox.ScriptBindings;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SpelScriptEngine")
class SpelScriptEngineTest {

    private final SpelScriptEngine engine = new SpelScriptEngine();

    private Object eval(String source, ScriptBindings bindings) {
        return engine.compile(source).evaluate(bindings);
    }

    @Nested
    @DisplayName("Compile")
    class Compile {

        @Test
        void blankSourceRejected() {
            assertThatThrownBy(() -> engine.compile("  "))
                    .isInstanceOf(ScriptCompileException.class)
                    .hasMessageContaining("empty");
        }

        @Test
        void syntaxErrorRejected() {
            assertThatThrownBy(() -> engine.compile("#msg.length( +"))
                    .isInstanceOf(ScriptCompileException.class)
                    .hasMessageContaining("Failed to compile SpEL script");
        }
    }

    @Nested
    @DisplayName("Evaluate")
    class Evaluate {

        @Test
        @DisplayName("bindings are variables")
        void bindingsAsVariables() {
            ScriptBindings bindings = ScriptBindings.builder().bind("msg", "PID|1").build();

            assertThat(eval("#msg.split('\\|')[0]", bindings)).isEqualTo("PID");
            assertThat(eval("#msg.length() > 3", bindings)).isEqualTo(true);
        }

        @Test
        @DisplayName("maps can be read by key and written through put")
        void mapAccess() {
            Map<String, Object> channelMap = new HashMap<>(Map.of("count", 1));
            ScriptBindings bindings = ScriptBindings.builder().bind("channelMap", channelMap).build();

            assertThat(eval("#channelMap['count']", bindings)).isEqualTo(1);
            eval("#channelMap.put('tag', 'seen')", bindings);

            assertThat(channelMap).containsEntry("tag", "seen");
        }

        @Test
        @DisplayName("type references are unavailable")
        void typeReferencesBlocked() {
            assertThatThrownBy(() -> eval("T(java.lang.Runtime).getRuntime()", ScriptBindings.empty()))
                    .isInstanceOf(ScriptRuntimeException.class);
        }

        @Test
        @DisplayName("constructors are unavailable")
        void constructorsBlocked() {
            assertThatThrownBy(() -> eval("new java.io.File('/tmp')", ScriptBindings.empty()))
                    .isInstanceOf(ScriptRuntimeException.class);
        }

        @Test
        @DisplayName("method call on a missing binding is a runtime failure")
        void nullReceiver() {
            assertThatThrownBy(() -> eval("#nothing.trim()", ScriptBindings.empty()))
                    .isInstanceOf(ScriptRuntimeException.class)
                    .hasMessageContaining("SpEL evaluation failed");
        }
    }

    @Nested
    @DisplayName("Helper functions")
    class Helpers {

        @Test
        void regexMatchAndExtract() {
            ScriptBindings bindings = ScriptBindings.builder().bind("msg", "MSH|^~\\&|LAB|ACME").build();

            assertThat(eval("#regex_match(#msg, 'LAB')", bindings)).isEqualTo(true);
            assertThat(eval("#regex_match(#msg, '^PID')", bindings)).isEqualTo(false);
            assertThat(eval("#regex_extract(#msg, '\\|(\\w+)\\|(\\w+)$', 2)", bindings)).isEqualTo("ACME");
            assertThat(eval("#regex_extract(#msg, 'ZZZ', 0)", bindings)).isNull();
        }

        @Test
        void base64() {
            assertThat(eval("#base64_encode('hello')", ScriptBindings.empty())).isEqualTo("aGVsbG8=");
            assertThat(eval("#base64_decode('aGVsbG8=')", ScriptBindings.empty())).isEqualTo("hello");
        }

        @Test
        void uuid() {
            assertThat((String) eval("#uuid()", ScriptBindings.empty())).hasSize(36);
        }

        @Test
        void registeredNames() {
            assertThat(SpelFunctions.functions())
                    .containsOnlyKeys("uuid", "regex_match", "regex_extract", "base64_encode", "base64_decode");
        }
    }
}
