package com.fieldops.sync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TelematicsCredentials(
    @JsonProperty("database") String database,
    @JsonProperty("userName") String userName,
    @JsonProperty("password") String password
) {

    @Override
    public String toString() {
        return "TelematicsCredentials[database=" + database + ", userName=" + userName + ", password=***]";
    }
}
