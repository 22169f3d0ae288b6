package com.fieldops.sync.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.sync.model.JsonRpcRequest;
import com.fieldops.sync.model.TelematicsCredentials;
import com.fieldops.sync.model.TelematicsSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON-RPC transport for the MyGeotab API.
 *
 * <p>Every request is a {@code POST /apiv1} with body {@code {"method", "params"}}.
 * Responses carry either {@code result} or {@code error.errors[0].name/message};
 * the latter is surfaced as {@link TelematicsApiException} for classification.
 * Sessions issued for another server ({@code path != "ThisServer"}) are followed
 * to that server on subsequent calls.
 */
public class GeotabJsonRpcTransport implements TelematicsTransport {

    private static final Logger log = LoggerFactory.getLogger(GeotabJsonRpcTransport.class);

    static final String API_PATH = "/apiv1";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public GeotabJsonRpcTransport(WebClient telematicsWebClient, ObjectMapper objectMapper) {
        this.webClient    = telematicsWebClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<TelematicsSession> authenticate(TelematicsCredentials credentials) {
        Map<String, Object> params = Map.of(
            "database", credentials.database(),
            "userName", credentials.userName(),
            "password", credentials.password()
        );

        log.info("[Telematics] Authenticating. database={} user={}", credentials.database(), credentials.userName());

        return post(API_PATH, new JsonRpcRequest("Authenticate", params))
            .map(result -> toSession(result, credentials));
    }

    @Override
    public Mono<JsonNode> call(TelematicsSession session, String method, Map<String, Object> params) {
        Map<String, Object> withCredentials = new LinkedHashMap<>(params);
        withCredentials.put("credentials", Map.of(
            "database",  session.database(),
            "userName",  session.userName(),
            "sessionId", session.sessionId()
        ));

        String uri = session.onSameServer() ? API_PATH : "https://" + session.path() + API_PATH;
        return post(uri, new JsonRpcRequest(method, withCredentials))
            .doOnSuccess(r -> log.debug("[Telematics] {} ok. typeName={} size={}",
                                        method, params.get("typeName"), r == null ? 0 : r.size()));
    }

    // ── private ───────────────────────────────────────────────────────────────

    private Mono<JsonNode> post(String uri, JsonRpcRequest request) {
        return webClient.post()
            .uri(uri)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(String.class)
            .map(this::extractResult);
    }

    private JsonNode extractResult(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TelematicsApiException("MalformedResponse", e.getOriginalMessage());
        }

        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            JsonNode first = error.path("errors").path(0);
            String name    = first.path("name").asText(error.path("name").asText("JSONRPCError"));
            String message = first.path("message").asText(error.path("message").asText("unknown error"));
            throw new TelematicsApiException(name, message);
        }
        return root.path("result");
    }

    private TelematicsSession toSession(JsonNode result, TelematicsCredentials credentials) {
        JsonNode creds = result.path("credentials");
        String sessionId = creds.path("sessionId").asText(null);
        if (sessionId == null || sessionId.isBlank()) {
            throw new TelematicsApiException("InvalidUserException", "authentication returned no session");
        }
        return new TelematicsSession(
            creds.path("database").asText(credentials.database()),
            creds.path("userName").asText(credentials.userName()),
            sessionId,
            result.path("path").asText(TelematicsSession.SAME_SERVER));
    }
}
