package com.enterprise.bulkload.load.infrastructure;

import com.enterprise.bulkload.load.application.BulkExecutor;
import com.enterprise.bulkload.load.application.BulkLoadService;
import com.enterprise.bulkload.load.application.CapabilityDetector;
import com.enterprise.bulkload.load.domain.BulkLoadRequest;
import com.enterprise.bulkload.load.domain.ColumnMapping;
import com.enterprise.bulkload.load.domain.Destination;
import com.enterprise.bulkload.load.domain.ReturnPolicy;
import com.enterprise.bulkload.load.domain.TransformKind;
import com.enterprise.bulkload.load.domain.TypedSource;
import com.enterprise.bulkload.shared.valueresolver.adapter.DefaultTypedValueResolver;
import com.enterprise.bulkload.shared.valueresolver.adapter.DefaultTypedValueWriter;
import com.enterprise.bulkload.shared.valueresolver.adapter.MapValueStore;
import com.enterprise.bulkload.shared.valueresolver.adapter.SpelExpressionEvaluator;
import com.enterprise.bulkload.shared.valueresolver.port.SourceKind;
import com.enterprise.bulkload.shared.valueresolver.port.ValueScope;
import com.enterprise.bulkload.sql.core.Dialects;
import com.enterprise.bulkload.sql.param.ParameterBinder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobInstance;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.scope.context.StepContext;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class BulkLoadTaskletTest {

    @TempDir
    Path dir;

    private BulkLoadService service() {
        ObjectMapper objectMapper = new ObjectMapper();
        return new BulkLoadService(
                new SqliteSessionFactory(new CapabilityDetector(Dialects.SQLITE)),
                new BulkExecutor(Dialects.SQLITE, new ParameterBinder(objectMapper)),
                new DefaultTypedValueResolver(new MockEnvironment(), objectMapper, new SpelExpressionEvaluator()),
                new DefaultTypedValueWriter());
    }

    @Test
    @SuppressWarnings("unchecked")
    void publishesSummaryToJobExecutionContext() throws Exception {
        Path db = dir.resolve("tasklet.db");
        new JdbcTemplate(new DriverManagerDataSource("jdbc:sqlite:" + db))
                .execute("CREATE TABLE stock (id INTEGER PRIMARY KEY, sku TEXT UNIQUE, qty INTEGER)");

        BulkLoadRequest request = BulkLoadRequest.builder()
                .database(TypedSource.message("databasePath"))
                .records(SourceKind.JSON, "[{\"sku\":\"A-1\",\"qty\":\"3\"},{\"sku\":\"B-2\",\"qty\":\"5\"}]")
                .table("stock")
                .map(ColumnMapping.of("sku"))
                .map(ColumnMapping.path("qty", "qty", TransformKind.NUMBER))
                .returning(ReturnPolicy.inserted("id"))
                .summaryTo(new Destination(ValueScope.FLOW, "bulkload"))
                .rowsTo(new Destination(ValueScope.FLOW, "bulkloadRows"))
                .build();
        BulkLoadTasklet tasklet = new BulkLoadTasklet(service(), request, new MapValueStore());

        JobExecution jobExecution = new JobExecution(new JobInstance(1L, "bulkLoadJob"), 1L,
                new JobParametersBuilder().addString("databasePath", db.toString()).toJobParameters());
        StepExecution stepExecution = new StepExecution("bulkLoadStep", jobExecution);
        StepContribution contribution = new StepContribution(stepExecution);

        RepeatStatus status = tasklet.execute(contribution, new ChunkContext(new StepContext(stepExecution)));

        assertThat(status).isEqualTo(RepeatStatus.FINISHED);
        assertThat(contribution.getWriteCount()).isEqualTo(2L);
        Map<String, Object> summary = (Map<String, Object>) jobExecution.getExecutionContext().get("bulkload");
        assertThat(summary).containsEntry("ok", true).containsEntry("table", "stock");
        assertThat((List<Object>) jobExecution.getExecutionContext().get("bulkloadRows")).hasSize(2);
    }
}
