package com.substratebridge.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Health verdict of a sink or source, computed fresh on every query.
 */
@Value
public class Status {

    /**
     * True when every partition of the topic is reachable.
     */
    @JsonProperty("working")
    boolean working;

    /**
     * Human-readable diagnostics; may be non-empty even when {@link #working} is true.
     */
    @JsonProperty("problems")
    List<String> problems;

    @JsonCreator
    public Status(@JsonProperty("working") boolean working,
                  @JsonProperty("problems") List<String> problems) {
        this.working = working;
        this.problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public static Status working() {
        return new Status(true, List.of());
    }

    public static Status working(List<String> problems) {
        return new Status(true, problems);
    }

    public static Status notWorking(List<String> problems) {
        return new Status(false, problems);
    }
}
