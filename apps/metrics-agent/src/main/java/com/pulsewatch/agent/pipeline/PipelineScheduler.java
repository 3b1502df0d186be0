package com.pulsewatch.agent.pipeline;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "pulsewatch.agent", name = "scheduling-enabled", havingValue = "true", matchIfMissing = true)
public class PipelineScheduler {

    private final DetectionPipeline pipeline;

    public PipelineScheduler(DetectionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Scheduled(fixedRateString = "${pulsewatch.agent.poll-interval:PT60S}")
    public void runCycleOnSchedule() {
        pipeline.runScheduledCycle();
    }
}
