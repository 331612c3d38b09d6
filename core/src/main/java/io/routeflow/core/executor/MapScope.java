package io.routeflow.core.executor;

import io.routeflow.core.model.ConnectorMessage;
import io.routeflow.core.sandbox.ScriptBindings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Working copies of a connector message's maps for one script call. Writes reach the message only through
 * {@link #commit}, which the executor calls after the script returned normally.
 *
 * <p>Nested maps, lists and sets are copied too, so a script that fails or times out cannot leave changes in
 * containers the message still holds; a sandbox thread that outlives its timeout only ever touches discarded copies.
 * {@code sourceMap} is read-only at every depth. Other values are shared as they are.
 */
final class MapScope {

    private final Map<String, Object> sourceMap;
    private final Map<String, Object> channelMap;
    private final Map<String, Object> connectorMap;
    private final Map<String, Object> responseMap;

    private MapScope(ConnectorMessage message) {
        this.sourceMap = frozenMap(message.sourceMap());
        this.channelMap = copyMap(message.channelMap());
        this.connectorMap = copyMap(message.connectorMap());
        this.responseMap = copyMap(message.responseMap());
    }

    static MapScope open(ConnectorMessage message) {
        return new MapScope(message);
    }

    Map<String, Object> channelMap() {
        return channelMap;
    }

    ScriptBindings bindings(String content, ConnectorMessage message) {
        return bindings(content, message, Map.of());
    }

    /** Standard bindings followed by call-site specific {@code extras}. */
    ScriptBindings bindings(String content, ConnectorMessage message, Map<String, ?> extras) {
        ScriptBindings.Builder builder = ScriptBindings.builder()
                .bind("msg", content)
                .bind("raw", message.rawData())
                .bind("message", MessageView.of(message))
                .bind("sourceMap", sourceMap)
                .bind("channelMap", channelMap)
                .bind("connectorMap", connectorMap)
                .bind("responseMap", responseMap);
        extras.forEach(builder::bind);
        return builder.build();
    }

    void commit(ConnectorMessage message) {
        replace(message.channelMap(), channelMap);
        replace(message.connectorMap(), connectorMap);
        replace(message.responseMap(), responseMap);
    }

    private static void replace(Map<String, Object> target, Map<String, Object> values) {
        target.clear();
        target.putAll(values);
    }

    static Map<String, Object> copyMap(Map<String, Object> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, copyValue(nested)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(nested -> copy.add(copyValue(nested)));
            return copy;
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            set.forEach(nested -> copy.add(copyValue(nested)));
            return copy;
        }
        return value;
    }

    private static Map<String, Object> frozenMap(Map<String, Object> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(key, frozenValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object frozenValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, frozenValue(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(nested -> copy.add(frozenValue(nested)));
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            set.forEach(nested -> copy.add(frozenValue(nested)));
            return Collections.unmodifiableSet(copy);
        }
        return value;
    }
}
