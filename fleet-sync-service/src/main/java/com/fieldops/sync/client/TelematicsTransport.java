package com.fieldops.sync.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fieldops.sync.model.TelematicsCredentials;
import com.fieldops.sync.model.TelematicsSession;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Strategy interface: live JSON-RPC ({@link GeotabJsonRpcTransport}) or demo data
 * ({@link MockTelematicsTransport}). Implementations perform exactly one remote
 * exchange per subscription and hold no authentication state of their own.
 */
public interface TelematicsTransport {

    Mono<TelematicsSession> authenticate(TelematicsCredentials credentials);

    /**
     * @param method remote method, e.g. {@code "Get"}
     * @param params method parameters; credentials are added by the transport
     * @return the raw {@code result} node
     */
    Mono<JsonNode> call(TelematicsSession session, String method, Map<String, Object> params);
}
