package com.newsdigest.backend.pipeline.dto;

import com.newsdigest.backend.config.DedupProperties;
import com.newsdigest.backend.config.PipelineMode;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.ToString;

/**
 * Everything one run needs, passed explicitly through its steps. Two runs never share one.
 */
@Getter
@ToString
public class RunState {
    private final String runId;
    private final PipelineMode mode;
    private final LocalDate day;
    private final DedupProperties.ModeSettings settings;
    @ToString.Exclude
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public RunState(String runId, PipelineMode mode, LocalDate day, DedupProperties.ModeSettings settings) {
        this.runId = runId;
        this.mode = mode;
        this.day = day;
        this.settings = settings;
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }
}
