package com.fieldops.sync.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fieldops.sync.model.TelematicsCredentials;
import com.fieldops.sync.model.TelematicsSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Demo transport serving four fixed trucks spread over Alabama. Used when
 * {@code telematics.mock-mode=true} so the field app can be exercised without
 * provider credentials. Positions and speeds never change between calls.
 */
public class MockTelematicsTransport implements TelematicsTransport {

    private static final Logger log = LoggerFactory.getLogger(MockTelematicsTransport.class);

    static final String MOCK_DATABASE = "demo";

    private static final double MPH_PER_KMH = 0.621371;

    private static final List<DemoTruck> TRUCKS = List.of(
        new DemoTruck("fiber-001",    "Fiber Truck 1",    "John Smith",    33.5186, -86.8104, 35, 45,  true),
        new DemoTruck("fiber-002",    "Fiber Truck 2",    "Sarah Johnson", 32.3668, -86.3000, 0,  180, true),
        new DemoTruck("electric-001", "Electric Truck 1", "Mike Wilson",   34.7304, -86.5861, 25, 90,  true),
        new DemoTruck("electric-002", "Electric Truck 2", "Lisa Davis",    30.6954, -88.0399, 0,  270, false)
    );

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MockTelematicsTransport(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    @Override
    public Mono<TelematicsSession> authenticate(TelematicsCredentials credentials) {
        return Mono.fromSupplier(() -> {
            String user = credentials.userName() == null ? "demo-user" : credentials.userName();
            log.info("[MockTelematics] Issued demo session. user={}", user);
            return new TelematicsSession(MOCK_DATABASE, user, "mock-" + UUID.randomUUID(),
                                         TelematicsSession.SAME_SERVER);
        });
    }

    @Override
    public Mono<JsonNode> call(TelematicsSession session, String method, Map<String, Object> params) {
        return Mono.fromSupplier(() -> {
            Object typeName = params.get("typeName");
            if (!"Get".equals(method)) {
                throw new TelematicsApiException("MissingMethodException", "mock transport does not support " + method);
            }
            if ("Device".equals(typeName)) {
                return devices();
            }
            if ("DeviceStatusInfo".equals(typeName)) {
                return statuses();
            }
            throw new TelematicsApiException("ArgumentException", "unknown typeName " + typeName);
        });
    }

    private JsonNode devices() {
        ArrayNode result = objectMapper.createArrayNode();
        for (DemoTruck truck : TRUCKS) {
            result.addObject()
                .put("id", truck.id())
                .put("name", truck.name())
                .put("comment", truck.installer());
        }
        return result;
    }

    private JsonNode statuses() {
        String now = clock.instant().toString();
        ArrayNode result = objectMapper.createArrayNode();
        for (DemoTruck truck : TRUCKS) {
            ObjectNode status = result.addObject();
            status.putObject("device").put("id", truck.id());
            status.put("latitude", truck.latitude())
                  .put("longitude", truck.longitude())
                  .put("speed", truck.speedMph() / MPH_PER_KMH)
                  .put("bearing", truck.bearing())
                  .put("dateTime", now)
                  .put("isDeviceCommunicating", truck.online());
        }
        return result;
    }

    private record DemoTruck(String id, String name, String installer,
                             double latitude, double longitude,
                             int speedMph, double bearing, boolean online) {}
}
