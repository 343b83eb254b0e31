package com.enterprise.bulkload.load.infrastructure;

import com.enterprise.bulkload.load.domain.BulkLoadRequest;
import com.enterprise.bulkload.load.domain.ColumnMapping;
import com.enterprise.bulkload.load.domain.ConflictPolicy;
import com.enterprise.bulkload.load.domain.Destination;
import com.enterprise.bulkload.load.domain.Pragmas;
import com.enterprise.bulkload.load.domain.ReturnMode;
import com.enterprise.bulkload.load.domain.ReturnPolicy;
import com.enterprise.bulkload.load.domain.SynchronousMode;
import com.enterprise.bulkload.load.domain.TransactionMode;
import com.enterprise.bulkload.load.domain.TransactionPolicy;
import com.enterprise.bulkload.load.domain.TransformKind;
import com.enterprise.bulkload.load.domain.TypedSource;
import com.enterprise.bulkload.shared.valueresolver.port.SourceKind;
import com.enterprise.bulkload.shared.valueresolver.port.ValueScope;
import com.enterprise.bulkload.sql.core.ConflictStrategy;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code bulkload.*} settings.
 *
 * <p>The {@code bulkload.job} block describes the request run by
 * {@code bulkLoadJob}; the job exists only when {@code bulkload.job.table} is set.
 * Job parameters form the invocation message, so a {@code MESSAGE} source such
 * as {@code database-kind: MESSAGE, database: databasePath} reads a job parameter.
 */
@ConfigurationProperties(prefix = "bulkload")
public class BulkLoadProperties {

    /** First SQLite version whose INSERT accepts RETURNING. */
    private String returningMinimumVersion = "3.35.0";

    /** Rows per transaction when the job uses CHUNKED and sets no chunk size. */
    private int defaultChunkSize = TransactionPolicy.DEFAULT_CHUNK_SIZE;

    /** Identifier column reported when the job sets none; blank means rowid. */
    private String defaultIdColumn = "id";

    private final Job job = new Job();

    public String getReturningMinimumVersion() { return returningMinimumVersion; }
    public void setReturningMinimumVersion(String v) { this.returningMinimumVersion = v; }
    public int getDefaultChunkSize() { return defaultChunkSize; }
    public void setDefaultChunkSize(int defaultChunkSize) { this.defaultChunkSize = defaultChunkSize; }
    public String getDefaultIdColumn() { return defaultIdColumn; }
    public void setDefaultIdColumn(String defaultIdColumn) { this.defaultIdColumn = defaultIdColumn; }
    public Job getJob() { return job; }

    /**
     * The request of the configured job, with the top-level defaults filled in.
     */
    public BulkLoadRequest toRequest() {
        Job j = job;
        int chunkSize = j.chunkSize > 0 ? j.chunkSize : defaultChunkSize;
        String idColumn = j.idColumn != null ? j.idColumn : defaultIdColumn;

        ConflictPolicy conflict = j.conflictStrategy == ConflictStrategy.UPSERT
                ? ConflictPolicy.upsert(j.conflictKeys, j.updateColumns)
                : new ConflictPolicy(j.conflictStrategy, List.of(), List.of());

        return BulkLoadRequest.builder()
                .database(new TypedSource(j.databaseKind, j.database))
                .pragmas(new Pragmas(j.wal, j.synchronous, j.extraPragmas))
                .records(j.recordsKind, j.records)
                .table(j.table)
                .autoMap(j.autoMap)
                .mappings(j.mappings.stream().map(Mapping::toColumnMapping).toList())
                .conflict(conflict)
                .transaction(new TransactionPolicy(j.transactionMode, chunkSize, j.continueOnError))
                .preSql(j.preSql)
                .postSql(j.postSql)
                .returning(new ReturnPolicy(j.returnMode, idColumn))
                .summaryTo(new Destination(j.summaryScope, j.summaryPath))
                .rowsTo(new Destination(j.rowsScope, j.rowsPath))
                .build();
    }

    public static class Job {

        private SourceKind databaseKind = SourceKind.MESSAGE;
        private String database = "databasePath";
        private SourceKind recordsKind = SourceKind.MESSAGE;
        private String records = "payload";
        private String table;
        private boolean autoMap;
        private List<Mapping> mappings = new ArrayList<>();
        private ConflictStrategy conflictStrategy = ConflictStrategy.NONE;
        private List<String> conflictKeys = new ArrayList<>();
        private List<String> updateColumns = new ArrayList<>();
        private TransactionMode transactionMode = TransactionMode.SINGLE;
        private int chunkSize;
        private boolean continueOnError;
        private String preSql;
        private String postSql;
        private ReturnMode returnMode = ReturnMode.NONE;
        private String idColumn;
        private boolean wal;
        private SynchronousMode synchronous;
        private String extraPragmas;
        private ValueScope summaryScope = ValueScope.FLOW;
        private String summaryPath = "bulkload";
        private ValueScope rowsScope = ValueScope.FLOW;
        private String rowsPath = "bulkloadRows";

        public SourceKind getDatabaseKind() { return databaseKind; }
        public void setDatabaseKind(SourceKind databaseKind) { this.databaseKind = databaseKind; }
        public String getDatabase() { return database; }
        public void setDatabase(String database) { this.database = database; }
        public SourceKind getRecordsKind() { return recordsKind; }
        public void setRecordsKind(SourceKind recordsKind) { this.recordsKind = recordsKind; }
        public String getRecords() { return records; }
        public void setRecords(String records) { this.records = records; }
        public String getTable() { return table; }
        public void setTable(String table) { this.table = table; }
        public boolean isAutoMap() { return autoMap; }
        public void setAutoMap(boolean autoMap) { this.autoMap = autoMap; }
        public List<Mapping> getMappings() { return mappings; }
        public void setMappings(List<Mapping> mappings) { this.mappings = mappings; }
        public ConflictStrategy getConflictStrategy() { return conflictStrategy; }
        public void setConflictStrategy(ConflictStrategy conflictStrategy) { this.conflictStrategy = conflictStrategy; }
        public List<String> getConflictKeys() { return conflictKeys; }
        public void setConflictKeys(List<String> conflictKeys) { this.conflictKeys = conflictKeys; }
        public List<String> getUpdateColumns() { return updateColumns; }
        public void setUpdateColumns(List<String> updateColumns) { this.updateColumns = updateColumns; }
        public TransactionMode getTransactionMode() { return transactionMode; }
        public void setTransactionMode(TransactionMode transactionMode) { this.transactionMode = transactionMode; }
        public int getChunkSize() { return chunkSize; }
        public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }
        public boolean isContinueOnError() { return continueOnError; }
        public void setContinueOnError(boolean continueOnError) { this.continueOnError = continueOnError; }
        public String getPreSql() { return preSql; }
        public void setPreSql(String preSql) { this.preSql = preSql; }
        public String getPostSql() { return postSql; }
        public void setPostSql(String postSql) { this.postSql = postSql; }
        public ReturnMode getReturnMode() { return returnMode; }
        public void setReturnMode(ReturnMode returnMode) { this.returnMode = returnMode; }
        public String getIdColumn() { return idColumn; }
        public void setIdColumn(String idColumn) { this.idColumn = idColumn; }
        public boolean isWal() { return wal; }
        public void setWal(boolean wal) { this.wal = wal; }
        public SynchronousMode getSynchronous() { return synchronous; }
        public void setSynchronous(SynchronousMode synchronous) { this.synchronous = synchronous; }
        public String getExtraPragmas() { return extraPragmas; }
        public void setExtraPragmas(String extraPragmas) { this.extraPragmas = extraPragmas; }
        public ValueScope getSummaryScope() { return summaryScope; }
        public void setSummaryScope(ValueScope summaryScope) { this.summaryScope = summaryScope; }
        public String getSummaryPath() { return summaryPath; }
        public void setSummaryPath(String summaryPath) { this.summaryPath = summaryPath; }
        public ValueScope getRowsScope() { return rowsScope; }
        public void setRowsScope(ValueScope rowsScope) { this.rowsScope = rowsScope; }
        public String getRowsPath() { return rowsPath; }
        public void setRowsPath(String rowsPath) { this.rowsPath = rowsPath; }
    }

    public static class Mapping {

        private String column;
        private SourceKind source = SourceKind.PATH;
        private String spec;
        private TransformKind transform = TransformKind.NONE;

        public String getColumn() { return column; }
        public void setColumn(String column) { this.column = column; }
        public SourceKind getSource() { return source; }
        public void setSource(SourceKind source) { this.source = source; }
        public String getSpec() { return spec; }
        public void setSpec(String spec) { this.spec = spec; }
        public TransformKind getTransform() { return transform; }
        public void setTransform(TransformKind transform) { this.transform = transform; }

        ColumnMapping toColumnMapping() {
            return new ColumnMapping(column, source, spec != null ? spec : column, transform);
        }
    }
}
