package com.bulkvalidate.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class CustomerRecord {
    @JsonProperty("full_name")
    public final String fullName;
    @JsonProperty("email")
    public final String email;

    @JsonCreator
    public CustomerRecord(@JsonProperty("full_name") String fullName,
                          @JsonProperty("email") String email) {
        // null => empty
        this.fullName = fullName == null ? "" : fullName;
        this.email = email == null ? "" : email;
    }

    @Override
    public String toString() {
        return "CustomerRecord{fullName='" + fullName + "', email='" + email + "'}";
    }
}
