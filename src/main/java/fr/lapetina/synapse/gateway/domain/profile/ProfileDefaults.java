package fr.lapetina.synapse.gateway.domain.profile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static fr.lapetina.synapse.gateway.domain.profile.ProfileSchema.ENABLE_THINKING;
import static fr.lapetina.synapse.gateway.domain.profile.ProfileSchema.MAX_TOKENS;
import static fr.lapetina.synapse.gateway.domain.profile.ProfileSchema.MIN_P;
import static fr.lapetina.synapse.gateway.domain.profile.ProfileSchema.REASONING_EFFORT;
import static fr.lapetina.synapse.gateway.domain.profile.ProfileSchema.REPEAT_PENALTY;
import static fr.lapetina.synapse.gateway.domain.profile.ProfileSchema.SYSTEM_PROMPT;
import static fr.lapetina.synapse.gateway.domain.profile.ProfileSchema.TEMPERATURE;
import static fr.lapetina.synapse.gateway.domain.profile.ProfileSchema.TOP_K;
import static fr.lapetina.synapse.gateway.domain.profile.ProfileSchema.TOP_P;

/**
 * Merges a stored profile into a chat-completion payload.
 *
 * Profile values only fill gaps: anything the caller set is left untouched,
 * and applying the same profile twice changes nothing the second time.
 */
public final class ProfileDefaults {

    private static final List<String> SAMPLING_KEYS = List.of(
            TEMPERATURE, TOP_P, TOP_K, MIN_P, REPEAT_PENALTY, MAX_TOKENS);

    private static final Pattern REASONING_LINE =
            Pattern.compile("(?im)^Reasoning:\\s*(low|medium|high)\\s*$");

    private static final String CHAT_TEMPLATE_KWARGS = "chat_template_kwargs";

    private ProfileDefaults() {
    }

    /**
     * Applies the profile to the payload in place.
     *
     * @return true if the payload was modified
     */
    public static boolean apply(ObjectNode payload, Map<String, Object> profile) {
        if (payload == null || profile == null || profile.isEmpty()) {
            return false;
        }
        boolean changed = false;

        for (String key : SAMPLING_KEYS) {
            Object value = profile.get(key);
            if (value != null && isUnset(payload.get(key))) {
                payload.set(key, toNode(value));
                changed = true;
            }
        }

        Object systemPrompt = profile.get(SYSTEM_PROMPT);
        if (systemPrompt instanceof String && !((String) systemPrompt).isBlank()) {
            changed |= insertSystemPrompt(payload, (String) systemPrompt);
        }

        Object reasoning = profile.get(REASONING_EFFORT);
        if (reasoning instanceof String && !((String) reasoning).isBlank()) {
            changed |= mergeReasoningLine(payload, (String) reasoning);
        }

        Object thinking = profile.get(ENABLE_THINKING);
        if (thinking != null) {
            changed |= fillThinkingFlag(payload, Boolean.parseBoolean(String.valueOf(thinking)));
        }
        return changed;
    }

    private static boolean insertSystemPrompt(ObjectNode payload, String prompt) {
        ArrayNode messages = messages(payload);
        if (messages == null || firstSystemMessage(messages) != null) {
            return false;
        }
        messages.insert(0, systemMessage(prompt));
        return true;
    }

    private static boolean mergeReasoningLine(ObjectNode payload, String level) {
        if (!isUnset(payload.get(REASONING_EFFORT))) {
            return false;
        }
        JsonNode kwargs = payload.get(CHAT_TEMPLATE_KWARGS);
        if (kwargs != null && kwargs.hasNonNull(REASONING_EFFORT)) {
            return false;
        }
        ArrayNode messages = messages(payload);
        if (messages == null) {
            return false;
        }

        String line = "Reasoning: " + level;
        ObjectNode system = firstSystemMessage(messages);
        if (system == null) {
            messages.insert(0, systemMessage(line));
            return true;
        }

        JsonNode content = system.get("content");
        if (content == null || content.isNull() || content.isTextual()) {
            String text = content == null || content.isNull() ? "" : content.asText();
            if (REASONING_LINE.matcher(text).find()) {
                return false;
            }
            system.put("content", text.isEmpty() ? line : line + "\n" + text);
            return true;
        }
        if (content.isArray()) {
            ArrayNode parts = (ArrayNode) content;
            for (JsonNode part : parts) {
                if (part.hasNonNull("text") && REASONING_LINE.matcher(part.get("text").asText()).find()) {
                    return false;
                }
            }
            ObjectNode part = parts.insertObject(0);
            part.put("type", "text");
            part.put("text", line);
            return true;
        }
        return false;
    }

    private static boolean fillThinkingFlag(ObjectNode payload, boolean enabled) {
        JsonNode existing = payload.get(CHAT_TEMPLATE_KWARGS);
        ObjectNode kwargs;
        if (existing == null || existing.isNull()) {
            kwargs = payload.putObject(CHAT_TEMPLATE_KWARGS);
        } else if (existing.isObject()) {
            kwargs = (ObjectNode) existing;
        } else {
            return false;
        }
        if (kwargs.has(ENABLE_THINKING)) {
            return false;
        }
        kwargs.put(ENABLE_THINKING, enabled);
        return true;
    }

    private static ArrayNode messages(ObjectNode payload) {
        JsonNode messages = payload.get("messages");
        return messages != null && messages.isArray() ? (ArrayNode) messages : null;
    }

    private static ObjectNode firstSystemMessage(ArrayNode messages) {
        for (JsonNode message : messages) {
            if (message.isObject() && "system".equals(message.path("role").asText(null))) {
                return (ObjectNode) message;
            }
        }
        return null;
    }

    private static ObjectNode systemMessage(String content) {
        ObjectNode message = JsonNodeFactory.instance.objectNode();
        message.put("role", "system");
        message.put("content", content);
        return message;
    }

    private static boolean isUnset(JsonNode node) {
        return node == null || node.isNull();
    }

    private static JsonNode toNode(Object value) {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        if (value instanceof Integer || value instanceof Long) {
            return nodes.numberNode(((Number) value).longValue());
        }
        if (value instanceof Number) {
            return nodes.numberNode(((Number) value).doubleValue());
        }
        if (value instanceof Boolean) {
            return nodes.booleanNode((Boolean) value);
        }
        return nodes.textNode(String.valueOf(value));
    }
}
