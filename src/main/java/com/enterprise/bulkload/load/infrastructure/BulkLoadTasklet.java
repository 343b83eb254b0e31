package com.enterprise.bulkload.load.infrastructure;

import com.enterprise.bulkload.load.application.BulkLoadService;
import com.enterprise.bulkload.load.domain.BulkLoadRequest;
import com.enterprise.bulkload.load.domain.ExecutionSummary;
import com.enterprise.bulkload.shared.valueresolver.adapter.ExecutionContextValueStore;
import com.enterprise.bulkload.shared.valueresolver.port.InvocationContext;
import com.enterprise.bulkload.shared.valueresolver.port.ValueStore;

import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs one bulk load as a step.
 *
 * <p>The job parameters become the invocation message, the job
 * {@link org.springframework.batch.item.ExecutionContext} is the flow store, so
 * the summary written to the flow scope is visible to later steps.
 * Inserted and updated rows are reported as the step's write count.
 */
public class BulkLoadTasklet implements Tasklet {

    private final BulkLoadService service;
    private final BulkLoadRequest request;
    private final ValueStore globalStore;

    public BulkLoadTasklet(BulkLoadService service, BulkLoadRequest request, ValueStore globalStore) {
        this.service = service;
        this.request = request;
        this.globalStore = globalStore;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        JobExecution job = chunkContext.getStepContext()
                .getStepExecution()
                .getJobExecution();

        Map<String, Object> message = new LinkedHashMap<>();
        job.getJobParameters().getParameters().forEach((name, param) -> message.put(name, param.getValue()));

        InvocationContext context = new InvocationContext(message,
                new ExecutionContextValueStore(job.getExecutionContext()), globalStore);
        ExecutionSummary summary = service.load(request, context);

        contribution.incrementWriteCount(summary.counts().inserted() + summary.counts().updated());
        return RepeatStatus.FINISHED;
    }
}
