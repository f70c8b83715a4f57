package fr.lapetina.synapse.gateway.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import fr.lapetina.synapse.gateway.api.dto.ProfileApplyRequest;
import fr.lapetina.synapse.gateway.api.dto.ProfileApplyResponse;
import fr.lapetina.synapse.gateway.api.dto.ProfileResponse;
import fr.lapetina.synapse.gateway.api.dto.ProfileUpdateRequest;
import fr.lapetina.synapse.gateway.domain.model.Backend;
import fr.lapetina.synapse.gateway.domain.model.TimeoutClass;
import fr.lapetina.synapse.gateway.domain.profile.ModelFamily;
import fr.lapetina.synapse.gateway.domain.profile.ProfileSchema;
import fr.lapetina.synapse.gateway.domain.profile.ProfileValidator;
import fr.lapetina.synapse.gateway.domain.profile.RequestValidationException;
import fr.lapetina.synapse.gateway.infrastructure.health.BackendRegistry;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendClient;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendException;
import fr.lapetina.synapse.gateway.infrastructure.http.BackendResponse;
import fr.lapetina.synapse.gateway.infrastructure.profile.ModelProfileStore;
import fr.lapetina.synapse.gateway.infrastructure.profile.ProfileRecord;
import fr.lapetina.synapse.gateway.orchestration.ModelLoadException;
import fr.lapetina.synapse.gateway.orchestration.ModelLoadOrchestrator;
import fr.lapetina.synapse.gateway.orchestration.ModelRegistryClient;
import fr.lapetina.synapse.gateway.orchestration.ModelView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Model registry and profile routes under /models.
 *
 * <ul>
 *   <li>GET /models: collapsed router registry with family and stored defaults</li>
 *   <li>POST /models/load, POST /models/unload: passthrough to the router</li>
 *   <li>GET /models/{id}/schema</li>
 *   <li>GET, PUT /models/{id}/profile</li>
 *   <li>POST /models/{id}/profile/apply</li>
 * </ul>
 * Model ids may contain slashes; the id is everything between {@code /models/} and the action suffix.
 */
final class ModelsHandler extends GatewayHandler {

    private static final Logger log = LoggerFactory.getLogger(ModelsHandler.class);

    static final String PATH = "/models";
    private static final String ERROR_LABEL = "LLM router error";

    private final BackendRegistry registry;
    private final BackendClient client;
    private final ModelRegistryClient modelRegistry;
    private final ModelLoadOrchestrator orchestrator;
    private final ModelProfileStore profileStore;
    private final String routerName;

    ModelsHandler(ObjectMapper objectMapper, BackendRegistry registry, BackendClient client,
                  ModelRegistryClient modelRegistry, ModelLoadOrchestrator orchestrator,
                  ModelProfileStore profileStore, String routerName) {
        super(objectMapper);
        this.registry = registry;
        this.client = client;
        this.modelRegistry = modelRegistry;
        this.orchestrator = orchestrator;
        this.profileStore = profileStore;
        this.routerName = routerName;
    }

    @Override
    protected void doHandle(HttpExchange exchange) throws Exception {
        String path = exchange.getRequestURI().getRawPath();
        String method = exchange.getRequestMethod();

        if (path.equals(PATH) || path.equals(PATH + "/")) {
            if (requireMethod(exchange, "GET")) {
                handleList(exchange);
            }
        } else if (!path.startsWith(PATH + "/")) {
            HttpExchanges.sendError(exchange, objectMapper, 404, "Not Found");
        } else if (path.equals(PATH + "/load")) {
            if (requireMethod(exchange, "POST")) {
                handleRouterCommand(exchange, "/models/load");
            }
        } else if (path.equals(PATH + "/unload")) {
            if (requireMethod(exchange, "POST")) {
                handleRouterCommand(exchange, "/models/unload");
            }
        } else if (path.endsWith("/profile/apply")) {
            String modelId = modelId(path, "/profile/apply");
            if (requireMethod(exchange, "POST")) {
                handleApply(exchange, modelId);
            }
        } else if (path.endsWith("/profile")) {
            String modelId = modelId(path, "/profile");
            if ("GET".equalsIgnoreCase(method)) {
                HttpExchanges.sendJson(exchange, objectMapper, 200, profileResponse(modelId));
            } else if (requireMethod(exchange, "PUT")) {
                handleUpdate(exchange, modelId);
            }
        } else if (path.endsWith("/schema")) {
            String modelId = modelId(path, "/schema");
            if (requireMethod(exchange, "GET")) {
                HttpExchanges.sendJson(exchange, objectMapper, 200, ProfileSchema.forModel(modelId));
            }
        } else {
            HttpExchanges.sendError(exchange, objectMapper, 404, "Not Found");
        }
    }

    private void handleList(HttpExchange exchange) throws Exception {
        Backend router = registry.require(routerName);
        List<Map<String, Object>> data = new ArrayList<>();
        for (ModelView view : modelRegistry.listLogicalModels(router)) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", view.id());
            entry.put("status", view.status());
            entry.put("failed", view.failed());
            entry.put("args", view.args());
            entry.put("runtime_hints", view.runtimeHints());
            if (view.parts() > 1) {
                entry.put("parts", view.parts());
                entry.put("members", view.memberIds());
            }
            entry.put("family", ModelFamily.infer(view.id()));
            entry.put("profile_defaults", profileStore.getProfile(view.id()));
            data.add(entry);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("object", "list");
        body.put("data", data);
        HttpExchanges.sendJson(exchange, objectMapper, 200, body);
    }

    private void handleRouterCommand(HttpExchange exchange, String routerPath) throws Exception {
        byte[] body = HttpExchanges.readBody(exchange);
        Backend router = registry.require(routerName);
        BackendResponse response = client.request(router.name(), "POST", router.resolve(routerPath),
                TimeoutClass.DEFAULT, body, Map.of("Content-Type", HttpExchanges.JSON));
        relay(exchange, response, ERROR_LABEL);
    }

    private void handleUpdate(HttpExchange exchange, String modelId) throws Exception {
        ProfileUpdateRequest request = objectMapper.readValue(HttpExchanges.readBody(exchange), ProfileUpdateRequest.class);
        if (request == null || request.getValues() == null) {
            throw new RequestValidationException("Field 'values' must be an object");
        }
        Map<String, Object> normalized = ProfileValidator.validate(ProfileSchema.forModel(modelId), request.getValues());
        if (request.isReplace()) {
            profileStore.setProfile(modelId, normalized);
        } else {
            profileStore.patchProfile(modelId, normalized);
        }
        log.info("Model profile updated: model={}, keys={}, replace={}", modelId, normalized.keySet(), request.isReplace());
        HttpExchanges.sendJson(exchange, objectMapper, 200, profileResponse(modelId));
    }

    private void handleApply(HttpExchange exchange, String modelId) throws Exception {
        byte[] raw = HttpExchanges.readBody(exchange);
        ProfileApplyRequest request = raw.length == 0
                ? new ProfileApplyRequest()
                : objectMapper.readValue(raw, ProfileApplyRequest.class);

        ProfileApplyResponse.LoadResult load = ProfileApplyResponse.LoadResult.notRequested();
        if (request != null && request.isLoadModel()) {
            load = loadModel(modelId);
        }
        Map<String, Object> values = profileStore.getProfile(modelId);
        HttpExchanges.sendJson(exchange, objectMapper, 200, new ProfileApplyResponse(modelId, values, load));
    }

    private ProfileApplyResponse.LoadResult loadModel(String modelId) {
        try {
            orchestrator.ensureModelLoaded(registry.require(routerName), modelId);
            return new ProfileApplyResponse.LoadResult(true, true, 200, null);
        } catch (ModelLoadException e) {
            Integer status = e.getUpstreamStatus() != null ? e.getUpstreamStatus() : e.getReason().getHttpStatus();
            log.warn("Profile apply could not load model: model={}, reason={}, error={}",
                    modelId, e.getReason(), e.getMessage());
            return new ProfileApplyResponse.LoadResult(true, false, status, e.getMessage());
        } catch (BackendException e) {
            log.warn("Profile apply could not reach router: model={}, error={}", modelId, e.getMessage());
            return new ProfileApplyResponse.LoadResult(true, false, ErrorMapper.map(e).status(), e.getMessage());
        }
    }

    private ProfileResponse profileResponse(String modelId) {
        Optional<ProfileRecord> record = profileStore.getRecord(modelId);
        return new ProfileResponse(
                modelId,
                ModelFamily.infer(modelId),
                record.map(ProfileRecord::values).orElse(Map.of()),
                record.map(ProfileRecord::updatedAt).orElse(null)
        );
    }

    private static String modelId(String rawPath, String suffix) {
        int start = PATH.length() + 1;
        int end = rawPath.length() - suffix.length();
        String modelId = end > start ? HttpExchanges.decode(rawPath.substring(start, end)) : "";
        if (modelId.isBlank()) {
            throw new RequestValidationException("Model id is required");
        }
        return modelId;
    }
}
