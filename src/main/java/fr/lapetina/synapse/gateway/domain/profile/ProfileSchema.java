package fr.lapetina.synapse.gateway.domain.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Editable settings for one model: the common sampling fields plus the ones
 * specific to the model's family.
 */
public record ProfileSchema(
        @JsonProperty("model_id") String modelId,
        @JsonProperty("family") ModelFamily family,
        @JsonProperty("fields") List<ProfileField> fields,
        @JsonProperty("notes") List<String> notes
) {
    public static final String SYSTEM_PROMPT = "system_prompt";
    public static final String TEMPERATURE = "temperature";
    public static final String TOP_P = "top_p";
    public static final String TOP_K = "top_k";
    public static final String MIN_P = "min_p";
    public static final String REPEAT_PENALTY = "repeat_penalty";
    public static final String MAX_TOKENS = "max_tokens";
    public static final String REASONING_EFFORT = "reasoning_effort";
    public static final String ENABLE_THINKING = "enable_thinking";

    private static final List<ProfileField> COMMON_FIELDS = List.of(
            ProfileField.text(SYSTEM_PROMPT, "System prompt",
                    "Inserted as the first system message when the request carries none."),
            ProfileField.number(TEMPERATURE, "Temperature", 0.0, 2.0, 0.05, 0.8,
                    "Sampling temperature. Lower is more deterministic."),
            ProfileField.number(TOP_P, "Top P", 0.0, 1.0, 0.01, 0.95,
                    "Nucleus sampling cutoff."),
            ProfileField.integer(TOP_K, "Top K", 0, 500, 40L,
                    "Sample only among the K most likely tokens. 0 disables."),
            ProfileField.number(MIN_P, "Min P", 0.0, 1.0, 0.01, 0.05,
                    "Minimum token probability relative to the most likely token."),
            ProfileField.number(REPEAT_PENALTY, "Repeat penalty", 0.5, 2.0, 0.05, 1.0,
                    "Penalty applied to recently generated tokens."),
            ProfileField.integer(MAX_TOKENS, "Max tokens", 1, 131_072, null,
                    "Upper bound on generated tokens per response.")
    );

    private static final ProfileField REASONING_FIELD = ProfileField.choice(
            REASONING_EFFORT, "Reasoning effort", List.of("low", "medium", "high"), "medium",
            "Written as a 'Reasoning: <level>' line at the top of the system message.",
            ProfileField.REQUEST);

    private static final ProfileField THINKING_FIELD = ProfileField.choice(
            ENABLE_THINKING, "Thinking mode", List.of("true", "false"), "true",
            "Sent as chat_template_kwargs.enable_thinking.",
            ProfileField.REQUEST);

    public ProfileSchema {
        fields = List.copyOf(fields);
        notes = List.copyOf(notes);
    }

    /**
     * Builds the schema for a model id, inferring its family.
     */
    public static ProfileSchema forModel(String modelId) {
        ModelFamily family = ModelFamily.infer(modelId);
        List<ProfileField> fields = new ArrayList<>(COMMON_FIELDS);
        List<String> notes = new ArrayList<>();
        notes.add("Profile values are defaults: values sent by the caller always win.");

        switch (family) {
            case GPT_OSS:
                fields.add(REASONING_FIELD);
                notes.add("gpt-oss reads its reasoning level from the system message.");
                break;
            case QWEN3:
                fields.add(THINKING_FIELD);
                notes.add("Qwen3 thinking mode is toggled through the chat template.");
                break;
            default:
                break;
        }
        return new ProfileSchema(modelId, family, fields, notes);
    }

    public Optional<ProfileField> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }
}
