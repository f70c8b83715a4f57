package fr.lapetina.synapse.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Body of PUT /models/{id}/profile. A null value deletes the key on a patch;
 * {@code replace} swaps the whole profile instead.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProfileUpdateRequest {

    private Map<String, Object> values;
    private boolean replace;

    public Map<String, Object> getValues() { return values; }
    public void setValues(Map<String, Object> values) { this.values = values; }

    public boolean isReplace() { return replace; }
    public void setReplace(boolean replace) { this.replace = replace; }
}
