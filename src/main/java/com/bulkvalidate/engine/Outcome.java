package com.bulkvalidate.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Verdict for one job, tagged with the job's index. {@code message} is only set when invalid. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Outcome {
    public final int index;
    public final String email;
    public final boolean valid;
    public final String message;

    @JsonCreator
    public Outcome(@JsonProperty("index") int index,
                   @JsonProperty("email") String email,
                   @JsonProperty("valid") boolean valid,
                   @JsonProperty("message") String message) {
        this.index = index;
        this.email = email;
        this.valid = valid;
        this.message = valid ? null : message;
    }

    static Outcome of(Job job, Verdict verdict) {
        return new Outcome(job.index, job.payload.email.trim(), verdict.valid, verdict.message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Outcome)) return false;
        Outcome other = (Outcome) o;
        return index == other.index
                && valid == other.valid
                && Objects.equals(email, other.email)
                && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, email, valid, message);
    }

    @Override
    public String toString() {
        return "Outcome{index=" + index + ", email='" + email + "', valid=" + valid
                + (message == null ? "" : ", message='" + message + "'") + "}";
    }
}
