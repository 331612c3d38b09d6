package io.routeflow.core.executor;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.routeflow.core.model.ConnectorMessage;
import io.routeflow.core.model.ContentType;
import io.routeflow.core.model.Response;
import io.routeflow.core.model.ScriptStep;
import io.routeflow.core.model.Status;
import io.routeflow.core.model.StepType;
import io.routeflow.core.sandbox.EngineRegistry;
import io.routeflow.core.sandbox.ScriptBudget;
import io.routeflow.core.sandbox.ScriptSandbox;
import io.routeflow.core.testkit.TestMessages;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PostprocessorExecutor")
class PostprocessorExecutorTest {

    private static final Map<String, Status> STATUSES = Map.of("lab", Status.SENT, "billing", Status.ERROR);

    private ScriptSandbox sandbox;
    private PostprocessorExecutor executor;
    private ConnectorMessage source;
    private ConnectorMessage merged;

    @BeforeEach
    void setUp() {
        sandbox = new ScriptSandbox(EngineRegistry.withDefaults(), new ScriptBudget(500));
        executor = new PostprocessorExecutor(sandbox, null);
        source = TestMessages.source(9L, "ADT^A01");
        source.setStatus(Status.TRANSFORMED);
        merged = source.toMergeBase();
    }

    @AfterEach
    void tearDown() {
        sandbox.close();
    }

    private static ScriptStep postprocessor(String script) {
        return ScriptStep.of(0, "postprocessor", StepType.SCRIPT, script);
    }

    @Test
    @DisplayName("a returned value becomes a SENT reply under d_postprocessor")
    void valueBecomesReply() {
        Optional<Response> reply = executor.execute(postprocessor("'done:' + #msg"), source, merged, STATUSES);

        assertThat(reply).get().isEqualTo(new Response(Status.SENT, "done:ADT^A01"));
        assertThat(source.responseMap()).containsEntry(PostprocessorExecutor.RESPONSE_KEY, reply.get());
    }

    @Test
    @DisplayName("a returned Response is stored as it is")
    void responseKept() {
        Response lab = new Response(Status.SENT, "AA", "accepted", null);
        merged.responseMap().put("lab", lab);

        Optional<Response> reply = executor.execute(postprocessor("#responseMap['lab']"), source, merged, STATUSES);

        assertThat(reply).contains(lab);
        assertThat(source.responseMap()).containsEntry("d_postprocessor", lab);
    }

    @Test
    @DisplayName("sees destination statuses by connector name")
    void seesStatuses() {
        Optional<Response> reply = executor.execute(
                postprocessor("#statuses['lab'].name() + ',' + #statuses['billing'].name()"), source, merged, STATUSES);

        assertThat(reply).get().extracting(Response::message).isEqualTo("SENT,ERROR");
    }

    @Test
    @DisplayName("channel map writes reach the source; a null result stores no reply")
    void channelMapSyncedBack() {
        merged.channelMap().put("fromDestination", "lab");

        Optional<Response> reply =
                executor.execute(postprocessor("#channelMap.put('audited', true)"), source, merged, STATUSES);

        assertThat(reply).isEmpty();
        assertThat(source.channelMap()).containsEntry("audited", true).containsEntry("fromDestination", "lab");
        assertThat(source.responseMap()).doesNotContainKey(PostprocessorExecutor.RESPONSE_KEY);
    }

    @Test
    @DisplayName("a failure is stored without changing any status")
    void failureStored() throws Exception {
        Optional<Response> reply = executor.execute(
                postprocessor("#channelMap.put('audited', true) == null ? #msg.substring(100) : null"),
                source,
                merged,
                STATUSES);

        assertThat(reply).isEmpty();
        assertThat(source.status()).isEqualTo(Status.TRANSFORMED);
        assertThat(source.channelMap()).doesNotContainKey("audited");
        assertThat(source.responseMap()).doesNotContainKey(PostprocessorExecutor.RESPONSE_KEY);
        assertThat(new ObjectMapper()
                        .readTree(source.contentText(ContentType.POSTPROCESSOR_ERROR))
                        .path("kind")
                        .asText())
                .isEqualTo("SCRIPT_RUNTIME");
    }

    @Test
    @DisplayName("a disabled or missing postprocessor does nothing")
    void disabled() {
        assertThat(executor.execute(postprocessor("#msg.substring(100)").disabled(), source, merged, STATUSES)).isEmpty();
        assertThat(executor.execute(null, source, merged, STATUSES)).isEmpty();
        assertThat(source.content(ContentType.POSTPROCESSOR_ERROR)).isEmpty();
    }
}
