package io.routeflow.core.batch;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BatchReaderTest {

    @Test
    void readsLinesWithAnyTerminator() {
        BatchReader reader = new BatchReader("a\r\nb\rc\nd");

        assertThat(reader.readLine()).isEqualTo("a");
        assertThat(reader.readLine()).isEqualTo("b");
        assertThat(reader.readLine()).isEqualTo("c");
        assertThat(reader.readLine()).isEqualTo("d");
        assertThat(reader.readLine()).isNull();
        assertThat(reader.hasMore()).isFalse();
    }

    @Test
    void peekDoesNotConsume() {
        BatchReader reader = new BatchReader("x\ny");

        assertThat(reader.peek()).isEqualTo("x");
        assertThat(reader.readLine()).isEqualTo("x");
        assertThat(reader.peek()).isEqualTo("y");
    }

    @Test
    void readUntilNextStopsBeforeMatchingLine() {
        BatchReader reader = new BatchReader("MSH|1\nPID|1\nMSH|2\nPID|2");

        assertThat(reader.readUntilNext("^MSH")).isEqualTo("MSH|1\nPID|1");
        assertThat(reader.readUntilNext("^MSH")).isEqualTo("MSH|2\nPID|2");
        assertThat(reader.readUntilNext("^MSH")).isNull();
    }

    @Test
    void nullContentIsEmpty() {
        BatchReader reader = new BatchReader(null);

        assertThat(reader.hasMore()).isFalse();
        assertThat(reader.peek()).isNull();
    }
}
