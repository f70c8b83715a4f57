package fr.lapetina.synapse.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of POST /models/{id}/profile/apply.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProfileApplyRequest {

    @JsonProperty("load_model")
    private boolean loadModel;

    public boolean isLoadModel() { return loadModel; }
    public void setLoadModel(boolean loadModel) { this.loadModel = loadModel; }
}
