package com.enterprise.bulkload.load.infrastructure;

import com.enterprise.bulkload.load.domain.BulkLoadRequest;
import com.enterprise.bulkload.load.domain.ReturnMode;
import com.enterprise.bulkload.load.domain.TransactionMode;
import com.enterprise.bulkload.load.domain.TransformKind;
import com.enterprise.bulkload.load.domain.exception.LoadConfigurationException;
import com.enterprise.bulkload.shared.valueresolver.port.SourceKind;
import com.enterprise.bulkload.sql.core.ConflictStrategy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BulkLoadPropertiesTest {

    @Test
    void jobBlockBecomesARequest() {
        BulkLoadProperties props = new BulkLoadProperties();
        BulkLoadProperties.Job job = props.getJob();
        job.setTable("stock");
        job.setConflictStrategy(ConflictStrategy.UPSERT);
        job.setConflictKeys(List.of("sku"));
        job.setUpdateColumns(List.of("qty"));
        job.setTransactionMode(TransactionMode.CHUNKED);
        job.setReturnMode(ReturnMode.AFFECTED);
        BulkLoadProperties.Mapping qty = new BulkLoadProperties.Mapping();
        qty.setColumn("qty");
        qty.setTransform(TransformKind.NUMBER);
        job.setMappings(List.of(qty));

        BulkLoadRequest request = props.toRequest();

        assertThat(request.table()).isEqualTo("stock");
        assertThat(request.database().kind()).isEqualTo(SourceKind.MESSAGE);
        assertThat(request.database().spec()).isEqualTo("databasePath");
        assertThat(request.conflict().keys()).containsExactly("sku");
        assertThat(request.transaction().chunkSize()).isEqualTo(500);
        assertThat(request.returning().idColumn()).isEqualTo("id");
        assertThat(request.mappings()).singleElement()
                .satisfies(m -> {
                    assertThat(m.source()).isEqualTo("qty");
                    assertThat(m.transform()).isEqualTo(TransformKind.NUMBER);
                });
    }

    @Test
    void upsertWithoutKeysIsRejected() {
        BulkLoadProperties props = new BulkLoadProperties();
        props.getJob().setTable("stock");
        props.getJob().setConflictStrategy(ConflictStrategy.UPSERT);

        assertThatThrownBy(props::toRequest).isInstanceOf(LoadConfigurationException.class);
    }
}
