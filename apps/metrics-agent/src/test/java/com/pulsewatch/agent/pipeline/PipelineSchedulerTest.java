package com.pulsewatch.agent.pipeline;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class PipelineSchedulerTest {

    @Test
    void tickRunsScheduledCycle() {
        DetectionPipeline pipeline = mock(DetectionPipeline.class);
        when(pipeline.runScheduledCycle()).thenReturn(Optional.empty());

        new PipelineScheduler(pipeline).runCycleOnSchedule();

        verify(pipeline).runScheduledCycle();
    }
}
