package io.ipamsync.api.models.responses;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * Response model for the sync status.
 */
@Data
@Builder
public class SyncStatusResponse {

    @JsonProperty("name")
    private String name;

    @JsonProperty("running")
    private boolean running;

    @JsonProperty("completed_runs")
    private int completedRuns;

    @JsonProperty("priority")
    private String priority;

    @JsonProperty("cron_mode")
    private boolean cronMode;
}
