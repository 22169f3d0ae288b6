package com.fieldops.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Session returned by a successful authentication.
 *
 * @param path server the session lives on; {@code "ThisServer"} or {@code null}
 *             means the server that authenticated it
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelematicsSession(
    @JsonProperty("database") String database,
    @JsonProperty("userName") String userName,
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("path") String path
) {

    public static final String SAME_SERVER = "ThisServer";

    public boolean onSameServer() {
        return path == null || path.isBlank() || SAME_SERVER.equalsIgnoreCase(path);
    }

    /** Session id shortened for logs. */
    public String maskedSessionId() {
        if (sessionId == null) {
            return "<none>";
        }
        return sessionId.substring(0, Math.min(6, sessionId.length())) + "***";
    }
}
