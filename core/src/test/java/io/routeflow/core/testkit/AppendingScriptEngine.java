package io.routeflow.core.testkit;

import io.routeflow.core.error.ScriptRuntimeException;
import io.routeflow.core.spi.CompiledScript;
import io.routeflow.core.spi.ScriptEngine;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Test engine whose scripts append their source to the list at {@code channelMap['items']} and then block until
 * interrupted, appending once more after the interrupt. {@link #awaitFinished} waits for a call to fully unwind.
 */
public final class AppendingScriptEngine implements ScriptEngine {

    public static final String ENGINE_ID = "append";

    private final CountDownLatch finished = new CountDownLatch(1);

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    @SuppressWarnings("unchecked")
    public CompiledScript compile(String source) {
        return bindings -> {
            try {
                List<Object> items = (List<Object>) ((Map<String, Object>) bindings.get("channelMap")).get("items");
                items.add(source);
                try {
                    Thread.sleep(Long.MAX_VALUE);
                    return null;
                } catch (InterruptedException e) {
                    items.add(source + "-late");
                    Thread.currentThread().interrupt();
                    throw new ScriptRuntimeException("interrupted", e, null);
                }
            } finally {
                finished.countDown();
            }
        };
    }

    /** @return whether a call finished within the timeout */
    public boolean awaitFinished(long timeoutMs) throws InterruptedException {
        return finished.await(timeoutMs, TimeUnit.MILLISECONDS);
    }
}
