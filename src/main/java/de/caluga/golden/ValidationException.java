package de.caluga.golden;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Thrown by deserialization when the incoming data does not fit the declared fields.
 * <p>
 * All problems found in one pass are collected - the messages are keyed by the external field name
 * (nested fields by their path, e.g. {@code alchemists.0.name}).
 */
public class ValidationException extends RuntimeException {

    public static final String SCHEMA_KEY = "_schema";

    private final Map<String, List<String>> messages;

    public ValidationException(Map<String, List<String>> messages) {
        super(buildMessage(messages));
        Map<String, List<String>> copy = new LinkedHashMap<>();

        for (Map.Entry<String, List<String>> e : messages.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
        }

        this.messages = Collections.unmodifiableMap(copy);
    }

    public ValidationException(String field, String message) {
        this(Collections.singletonMap(field, Collections.singletonList(message)));
    }

    /**
     * @return field path to list of error messages, in the order the fields were checked
     */
    public Map<String, List<String>> getMessages() {
        return messages;
    }

    public Set<String> getFieldNames() {
        return messages.keySet();
    }

    public List<String> getMessages(String field) {
        return messages.getOrDefault(field, Collections.emptyList());
    }

    private static String buildMessage(Map<String, List<String>> messages) {
        StringBuilder sb = new StringBuilder("Validation failed for ");
        sb.append(messages.size()).append(messages.size() == 1 ? " field: " : " fields: ");
        boolean comma = false;

        for (Map.Entry<String, List<String>> e : messages.entrySet()) {
            if (comma) {
                sb.append("; ");
            }

            comma = true;
            sb.append(e.getKey()).append(" - ").append(String.join(" ", e.getValue()));
        }

        return sb.toString();
    }
}
