package io.ipamsync.api.models.responses;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * Response model for a manually triggered sync run.
 */
@Data
@Builder
public class RunResponse {

    @JsonProperty("result")
    private String result;

    @JsonProperty("priority")
    private String priority;

    @JsonProperty("completed_runs")
    private int completedRuns;
}
