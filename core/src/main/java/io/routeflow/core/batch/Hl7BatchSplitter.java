package io.routeflow.core.batch;

import io.routeflow.core.model.BatchUnit;
import java.util.Optional;
import java.util.Set;

/**
 * Splits an HL7 v2 batch into messages. Segments may end with CR, LF or CRLF; batch envelope segments
 * ({@code FHS}, {@code BHS}, {@code BTS}, {@code FTS}) are dropped, every {@code MSH} opens a new message, and the
 * segments of one message are joined with CR.
 */
final class Hl7BatchSplitter implements BatchSplitter {

    private static final Set<String> ENVELOPE = Set.of("FHS", "BHS", "BTS", "FTS");

    private final BatchReader segments;
    private int sequenceId;

    Hl7BatchSplitter(String content) {
        this.segments = new BatchReader(content);
    }

    @Override
    public Optional<BatchUnit> nextUnit() {
        StringBuilder message = null;
        String segment;
        while ((segment = segments.peek()) != null) {
            String id = segmentId(segment);
            if (segment.isBlank() || ENVELOPE.contains(id)) {
                segments.readLine();
                continue;
            }
            if ("MSH".equals(id) && message != null) {
                break;
            }
            segments.readLine();
            if (message == null) {
                message = new StringBuilder(segment);
            } else {
                message.append('\r').append(segment);
            }
        }
        return message != null ? Optional.of(new BatchUnit(++sequenceId, message.toString())) : Optional.empty();
    }

    @Override
    public void reset() {
        segments.reset();
        sequenceId = 0;
    }

    private static String segmentId(String segment) {
        String trimmed = segment.stripLeading();
        return trimmed.length() >= 3 ? trimmed.substring(0, 3) : trimmed;
    }
}
