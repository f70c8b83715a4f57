package fr.lapetina.synapse.gateway.domain.profile;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Model family inferred from the model id. The family decides which
 * family-specific profile fields exist.
 */
public enum ModelFamily {
    GENERIC("generic"),
    GPT_OSS("gpt-oss"),
    QWEN3("qwen3");

    private static final Pattern GPT_OSS_ID = Pattern.compile("gpt[-_]?oss", Pattern.CASE_INSENSITIVE);
    private static final Pattern QWEN3_ID = Pattern.compile("qwen[-_]?3(?![.\\d])", Pattern.CASE_INSENSITIVE);

    private final String wireName;

    ModelFamily(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Infers the family from a model id such as {@code gpt-oss-120b-Q4_K_M} or
     * {@code Qwen3-8B-Q4_K_M}. Qwen2.5 and other ids are generic.
     */
    public static ModelFamily infer(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            return GENERIC;
        }
        String id = modelId.toLowerCase(Locale.ROOT);
        if (GPT_OSS_ID.matcher(id).find()) {
            return GPT_OSS;
        }
        if (QWEN3_ID.matcher(id).find()) {
            return QWEN3;
        }
        return GENERIC;
    }
}
