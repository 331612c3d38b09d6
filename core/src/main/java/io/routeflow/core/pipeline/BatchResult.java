package io.routeflow.core.pipeline;

import io.routeflow.core.error.ScriptException;
import io.routeflow.core.model.Message;
import java.util.List;
import java.util.Optional;

/**
 * Messages produced from one raw payload, in batch sequence order.
 *
 * @param messages   one message per unit that was processed
 * @param batchError the unit fetch failure that ended the batch early, or {@code null}
 */
public record BatchResult(List<Message> messages, ScriptException batchError) {

    public BatchResult {
        messages = List.copyOf(messages);
    }

    public boolean isComplete() {
        return batchError == null;
    }

    public Optional<ScriptException> error() {
        return Optional.ofNullable(batchError);
    }
}
