package io.routeflow.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.routeflow.core.batch.BatchProcessor;
import io.routeflow.core.channel.ChannelDefinition;
import io.routeflow.core.channel.ChannelParser;
import io.routeflow.core.error.ConfigurationException;
import io.routeflow.core.error.ScriptTimeoutException;
import io.routeflow.core.executor.PostprocessorExecutor;
import io.routeflow.core.model.ConnectorMessage;
import io.routeflow.core.model.ContentType;
import io.routeflow.core.model.ErrorKind;
import io.routeflow.core.model.Message;
import io.routeflow.core.model.ProcessingError;
import io.routeflow.core.model.Response;
import io.routeflow.core.model.Status;
import io.routeflow.core.sandbox.EngineRegistry;
import io.routeflow.core.sandbox.ScriptSandbox;
import io.routeflow.core.testkit.SleepingScriptEngine;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

@DisplayName("MessagePipeline")
class MessagePipelineTest {

    private static final PipelineSettings SETTINGS = new PipelineSettings(300, 1, "node-7");

    private EngineRegistry engines;
    private ScriptSandbox sandbox;

    @BeforeEach
    void setUp() {
        engines = EngineRegistry.withDefaults().register(new SleepingScriptEngine());
        sandbox = SETTINGS.openSandbox(engines);
    }

    @AfterEach
    void tearDown() {
        sandbox.close();
    }

    private MessagePipeline pipeline(String yaml) {
        ChannelDefinition channel = new ChannelParser(engines).parse(yaml, "inline");
        return MessagePipeline.create(channel, sandbox, SETTINGS);
    }

    @Nested
    @DisplayName("Single message")
    class SingleMessage {

        private static final String ROUTER = """
                id: router
                source:
                  filter:
                    - name: only ADT
                      script: "#msg.startsWith('ADT')"
                  transformer:
                    - name: tag
                      script: "#channelMap.put('route', 'lab')"
                destinations:
                  - name: lab
                    transformer:
                      - name: upper
                        type: message-builder
                        script: "#msg.toUpperCase()"
                  - name: audit
                    filter:
                      - name: never
                        script: "false"
                response:
                  mode: destinations-completed
                """;

        @Test
        @DisplayName("accepted message runs every destination")
        void acceptedRunsDestinations() {
            MessagePipeline pipeline = pipeline(ROUTER);

            Message message = pipeline.processMessage("adt^a01", Map.of("remoteAddress", "10.0.0.1"));

            ConnectorMessage source = message.requireSource();
            assertThat(source.status()).isEqualTo(Status.TRANSFORMED);
            assertThat(source.connectorName()).isEqualTo(MessagePipeline.SOURCE_CONNECTOR_NAME);
            assertThat(source.serverId()).isEqualTo("node-7");
            assertThat(source.sourceMap()).containsEntry("remoteAddress", "10.0.0.1");
            assertThat(message.destinationCount()).isEqualTo(2);

            ConnectorMessage lab = message.get(1).orElseThrow();
            assertThat(lab.connectorName()).isEqualTo("lab");
            assertThat(lab.status()).isEqualTo(Status.TRANSFORMED);
            assertThat(lab.rawData()).isEqualTo("adt^a01");
            assertThat(lab.contentText(ContentType.ENCODED)).isEqualTo("ADT^A01");
            assertThat(lab.channelMap()).containsEntry("route", "lab");
            assertThat(message.get(2).orElseThrow().status()).isEqualTo(Status.FILTERED);
        }

        @Test
        @DisplayName("filtered source skips destinations")
        void filteredSkipsDestinations() {
            Message message = pipeline(ROUTER).processMessage("ORU^R01", Map.of());

            assertThat(message.requireSource().status()).isEqualTo(Status.FILTERED);
            assertThat(message.destinationCount()).isZero();
        }

        @Test
        @DisplayName("message ids increase per pipeline")
        void messageIds() {
            MessagePipeline pipeline = pipeline(ROUTER);

            assertThat(pipeline.processMessage("ADT", Map.of()).messageId()).isEqualTo(1L);
            assertThat(pipeline.processMessage("ADT", Map.of()).messageId()).isEqualTo(2L);
        }

        @Test
        @DisplayName("response after destinations ranks their statuses")
        void responseAfterDestinations() {
            MessagePipeline pipeline = pipeline(ROUTER);
            Message message = pipeline.processMessage("ADT", Map.of());
            message.get(1).orElseThrow().setStatus(Status.QUEUED);

            Response response = pipeline.selectResponse(message).orElseThrow();

            assertThat(response.status()).isEqualTo(Status.QUEUED);
        }

        @Test
        @DisplayName("response is ERROR when the source filtered before destinations existed")
        void responseWithMissingDestinations() {
            MessagePipeline pipeline = pipeline(ROUTER);
            Message message = pipeline.processMessage("ORU", Map.of());

            assertThat(pipeline.selectResponse(message)).get().extracting(Response::status).isEqualTo(Status.ERROR);
        }

        @Test
        @DisplayName("MDC carries channel and message id while processing and is cleared afterwards")
        void mdc() {
            Logger logger = (Logger) LoggerFactory.getLogger(MessagePipeline.class);
            ListAppender<ILoggingEvent> appender = new ListAppender<>() {
                @Override
                protected void append(ILoggingEvent event) {
                    event.prepareForDeferredProcessing();
                    super.append(event);
                }
            };
            appender.start();
            logger.addAppender(appender);
            try {
                pipeline(ROUTER).processMessage("ADT", Map.of());

                assertThat(appender.list)
                        .filteredOn(event -> event.getFormattedMessage().startsWith("message.processed"))
                        .singleElement()
                        .satisfies(event -> assertThat(event.getMDCPropertyMap())
                                .containsEntry(MessagePipeline.MDC_CHANNEL_ID, "router")
                                .containsEntry(MessagePipeline.MDC_MESSAGE_ID, "1"));
                assertThat(MDC.get(MessagePipeline.MDC_CHANNEL_ID)).isNull();
                assertThat(MDC.get(MessagePipeline.MDC_MESSAGE_ID)).isNull();
            } finally {
                logger.detachAppender(appender);
            }
        }

        @Test
        @DisplayName("failing source transformer stops the message with an error")
        void sourceError() {
            MessagePipeline pipeline = pipeline("""
                    id: broken
                    source:
                      transformer:
                        - name: boom
                          script: "#msg.substring(100)"
                    destinations:
                      - name: never
                    """);

            Message message = pipeline.processMessage("short", Map.of());

            assertThat(message.requireSource().status()).isEqualTo(Status.ERROR);
            assertThat(message.requireSource().contentText(ContentType.PROCESSING_ERROR)).contains("script-runtime");
            assertThat(message.destinationCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Destination set")
    class Destinations {

        @Test
        @DisplayName("destinations removed by the source are filtered without running")
        void removedDestinationsFiltered() {
            MessagePipeline pipeline = pipeline("""
                    id: split
                    source:
                      transformer:
                        - name: route
                          script: "#msg.startsWith('ORU') ? #destinationSet.remove('adt') : #destinationSet.remove(2)"
                    destinations:
                      - name: adt
                      - name: results
                        transformer:
                          - name: boom
                            script: "#msg.substring(100)"
                    """);

            Message message = pipeline.processMessage("ADT^A01", Map.of());

            assertThat(message.destinationCount()).isEqualTo(2);
            assertThat(message.get(1).orElseThrow().status()).isEqualTo(Status.TRANSFORMED);
            ConnectorMessage results = message.get(2).orElseThrow();
            assertThat(results.status()).isEqualTo(Status.FILTERED);
            assertThat(results.processingError()).isEmpty();
            assertThat(results.content(ContentType.TRANSFORMED)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Dispatch outcomes")
    class Outcomes {

        private static final String LIFECYCLE = """
                id: lifecycle
                source: {}
                destinations:
                  - name: lab
                    queue-enabled: true
                  - name: billing
                    response-transformer:
                      transformer:
                        - name: ack
                          type: message-builder
                          script: "'ACK:' + #msg"
                postprocessor:
                  script: "#channelMap.put('seen', #statuses['lab'].name()) == null ? #responseMap['billing'].message() : null"
                response:
                  mode: named
                  respond-from: d_postprocessor
                """;

        @Test
        @DisplayName("dispatch outcomes run response transformers and feed the postprocessor reply")
        void completeAndFinish() {
            MessagePipeline pipeline = pipeline(LIFECYCLE);
            Message message = pipeline.processMessage("ADT", Map.of());

            Response lab = pipeline.completeDestination(message, 1, new Response(Status.ERROR, "", null, "refused"));
            Response billing = pipeline.completeDestination(message, 2, new Response(Status.SENT, "AA"));

            assertThat(lab.status()).isEqualTo(Status.QUEUED);
            assertThat(message.get(1).orElseThrow().status()).isEqualTo(Status.QUEUED);
            assertThat(billing.message()).isEqualTo("ACK:AA");
            assertThat(message.get(2).orElseThrow().contentText(ContentType.RESPONSE_TRANSFORMED)).isEqualTo("ACK:AA");

            Optional<Response> reply = pipeline.finish(message);

            assertThat(reply).contains(new Response(Status.SENT, "ACK:AA"));
            ConnectorMessage source = message.requireSource();
            assertThat(source.responseMap()).containsKey(PostprocessorExecutor.RESPONSE_KEY);
            assertThat(source.channelMap()).containsEntry("seen", "QUEUED");
        }

        @Test
        @DisplayName("only transformed destinations of the channel can be completed")
        void rejectsUndispatchable() {
            MessagePipeline pipeline = pipeline(LIFECYCLE);
            Message message = pipeline.processMessage("ADT", Map.of());
            pipeline.completeDestination(message, 1, Response.sent());

            assertThatThrownBy(() -> pipeline.completeDestination(message, 1, Response.sent()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("'lab'");
            assertThatThrownBy(() -> pipeline.completeDestination(message, 3, Response.sent()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("a failing postprocessor leaves statuses alone and yields no named reply")
        void failingPostprocessor() {
            MessagePipeline pipeline = pipeline("""
                    id: post
                    source: {}
                    destinations:
                      - name: lab
                    postprocessor:
                      script: "#msg.substring(100)"
                    response:
                      mode: named
                      respond-from: d_postprocessor
                    """);
            Message message = pipeline.processMessage("ADT", Map.of());
            pipeline.completeDestination(message, 1, Response.sent());

            assertThat(pipeline.finish(message)).isEmpty();
            assertThat(message.requireSource().status()).isEqualTo(Status.TRANSFORMED);
            assertThat(message.get(1).orElseThrow().status()).isEqualTo(Status.SENT);
            assertThat(message.requireSource().contentText(ContentType.POSTPROCESSOR_ERROR)).contains("script-runtime");
        }
    }

    @Nested
    @DisplayName("Settings")
    class Settings {

        @Test
        @DisplayName("the configured script timeout aborts a stuck script")
        void configuredTimeoutAborts() {
            PipelineSettings settings = new PipelineSettings(150, 1, "node-7");
            try (ScriptSandbox timed = settings.openSandbox(engines)) {
                ChannelDefinition channel = new ChannelParser(engines).parse("""
                        id: stuck
                        source:
                          transformer:
                            - name: wait
                              lang: sleep
                              script: forever
                        """, "inline");
                MessagePipeline pipeline = MessagePipeline.create(channel, timed, settings);

                long start = System.nanoTime();
                Message message = pipeline.processMessage("x", Map.of());
                long elapsedMs = (System.nanoTime() - start) / 1_000_000;

                assertThat(message.requireSource().processingError()).get()
                        .extracting(ProcessingError::kind)
                        .isEqualTo(ErrorKind.SCRIPT_TIMEOUT);
                assertThat(message.requireSource().processingError().orElseThrow().detail()).contains("150 ms");
                assertThat(elapsedMs).isLessThan(5_000);
            }
        }

        @Test
        @DisplayName("a sandbox with a different budget is rejected")
        void mismatchedBudgetRejected() {
            ChannelDefinition channel = new ChannelParser(engines).parse("id: c\nsource: {}\n", "inline");

            assertThatThrownBy(() -> MessagePipeline.create(channel, sandbox, PipelineSettings.DEFAULTS))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("300 ms")
                    .hasMessageContaining("30000 ms");
        }
    }

    @Nested
    @DisplayName("Batch")
    class Batch {

        @Test
        @DisplayName("non-batch channel yields one message")
        void nonBatch() {
            BatchResult result = pipeline("id: plain\nsource: {}\n").processBatch("a\nb", Map.of());

            assertThat(result.messages()).hasSize(1);
            assertThat(result.isComplete()).isTrue();
            assertThat(result.messages().get(0).requireSource().rawData()).isEqualTo("a\nb");
        }

        @Test
        @DisplayName("each unit becomes a message seeded with its batch position")
        void unitsBecomeMessages() {
            MessagePipeline pipeline = pipeline("""
                    id: lines
                    batch:
                      split-type: record
                    source:
                      filter:
                        - name: skip blank
                          script: "!#msg.isEmpty()"
                    """);

            BatchResult result = pipeline.processBatch("a\n\nc\n", Map.of("file", "in.txt"));

            assertThat(result.messages()).hasSize(3);
            assertThat(result.messages())
                    .extracting(m -> m.requireSource().status())
                    .containsExactly(Status.TRANSFORMED, Status.FILTERED, Status.TRANSFORMED);
            Map<String, Object> last = result.messages().get(2).requireSource().sourceMap();
            assertThat(last)
                    .containsEntry("file", "in.txt")
                    .containsEntry(BatchProcessor.BATCH_SEQUENCE_ID, 3)
                    .containsEntry(BatchProcessor.BATCH_COMPLETE, true);
        }

        @Test
        @DisplayName("a failing unit does not stop later units")
        void failingUnitContinues() {
            MessagePipeline pipeline = pipeline("""
                    id: lines
                    batch:
                      split-type: record
                    source:
                      transformer:
                        - name: third char
                          type: mapper
                          script: "#msg.substring(2, 3)"
                    """);

            BatchResult result = pipeline.processBatch("abc\nx\ndef", Map.of());

            assertThat(result.messages())
                    .extracting(m -> m.requireSource().status())
                    .containsExactly(Status.TRANSFORMED, Status.ERROR, Status.TRANSFORMED);
        }

        @Test
        @DisplayName("a timed-out batch script ends the batch with an error")
        void batchScriptTimeout() {
            MessagePipeline pipeline = pipeline("""
                    id: stuck
                    batch:
                      split-type: script
                      lang: sleep
                      script: forever
                    source: {}
                    """);

            BatchResult result = pipeline.processBatch("a", Map.of());

            assertThat(result.isComplete()).isFalse();
            assertThat(result.messages()).isEmpty();
            assertThat(result.error()).get().isInstanceOf(ScriptTimeoutException.class);
        }
    }
}
