package io.routeflow.core.sandbox.spel;

import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.expression.EvaluationContext;

/**
 * Helper functions exposed to SpEL scripts as {@code #name(...)}. The method set is closed; scripts cannot register
 * their own.
 */
final class SpelFunctions {

    private static final Map<String, Method> FUNCTIONS = resolve();

    private SpelFunctions() {}

    /** Binds every helper into the context. Bindings registered later with the same name take precedence. */
    static void register(EvaluationContext context) {
        FUNCTIONS.forEach(context::setVariable);
    }

    static Map<String, Method> functions() {
        return FUNCTIONS;
    }

    public static String uuid() {
        return UUID.randomUUID().toString();
    }

    public static boolean regexMatch(String input, String regex) {
        if (input == null || regex == null) {
            return false;
        }
        return Pattern.compile(regex).matcher(input).find();
    }

    public static String regexExtract(String input, String regex, int group) {
        if (input == null || regex == null) {
            return null;
        }
        Matcher matcher = Pattern.compile(regex).matcher(input);
        if (!matcher.find() || group < 0 || group > matcher.groupCount()) {
            return null;
        }
        return matcher.group(group);
    }

    public static String base64Encode(String value) {
        if (value == null) {
            return null;
        }
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    public static String base64Decode(String value) {
        if (value == null) {
            return null;
        }
        return new String(Base64.getDecoder().decode(value), StandardCharsets.UTF_8);
    }

    private static Map<String, Method> resolve() {
        try {
            Map<String, Method> functions = new LinkedHashMap<>();
            functions.put("uuid", SpelFunctions.class.getMethod("uuid"));
            functions.put("regex_match", SpelFunctions.class.getMethod("regexMatch", String.class, String.class));
            functions.put(
                    "regex_extract",
                    SpelFunctions.class.getMethod("regexExtract", String.class, String.class, int.class));
            functions.put("base64_encode", SpelFunctions.class.getMethod("base64Encode", String.class));
            functions.put("base64_decode", SpelFunctions.class.getMethod("base64Decode", String.class));
            return Map.copyOf(functions);
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("Failed to register SpEL helper functions", e);
        }
    }
}
