package com.enterprise.bulkload.load.infrastructure;

import com.enterprise.bulkload.load.application.BulkLoadService;
import com.enterprise.bulkload.shared.valueresolver.port.ValueStore;

import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Single-step job running the request described under {@code bulkload.job}.
 * Only defined when {@code bulkload.job.table} is set.
 */
@Configuration
@ConditionalOnProperty(prefix = "bulkload.job", name = "table")
public class BulkLoadJobConfig {

    @Bean
    BulkLoadTasklet bulkLoadTasklet(BulkLoadService service,
                                    BulkLoadProperties properties,
                                    ValueStore globalValueStore) {
        return new BulkLoadTasklet(service, properties.toRequest(), globalValueStore);
    }

    // --- Step + Job ---

    @Bean
    Step bulkLoadStep(JobRepository jobRepository,
                      PlatformTransactionManager transactionManager,
                      BulkLoadTasklet bulkLoadTasklet) {
        return new StepBuilder("bulkLoadStep", jobRepository)
            .tasklet(bulkLoadTasklet, transactionManager)
            .build();
    }

    @Bean
    Job bulkLoadJob(JobRepository jobRepository, Step bulkLoadStep) {
        return new JobBuilder("bulkLoadJob", jobRepository)
            .start(bulkLoadStep)
            .build();
    }
}
