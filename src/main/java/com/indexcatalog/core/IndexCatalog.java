package com.indexcatalog.core;

import com.indexcatalog.config.CatalogConfig;
import com.indexcatalog.exception.CatalogException;
import com.indexcatalog.exception.ErrorCode;
import com.indexcatalog.exception.ValidationException;
import com.indexcatalog.index.IndexPartitionWriter;
import com.indexcatalog.query.QueryEngine;
import com.indexcatalog.query.RowBounds;
import com.indexcatalog.recovery.BackgroundRecovery;
import com.indexcatalog.recovery.RecoveryEngine;
import com.indexcatalog.recovery.RecoveryResult;
import com.indexcatalog.schema.CatalogSchema;
import com.indexcatalog.storage.S3TableStore;
import com.indexcatalog.storage.TableStore;
import com.indexcatalog.wal.WalOperation;
import com.indexcatalog.wal.WriteAheadLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Secondary-index catalog over a partitioned key-value store.
 * <p>
 * Mutations are WAL-first: once {@code insert} or {@code delete} has appended to
 * the log the effect is committed, and it becomes visible when a recovery pass
 * applies it. Under {@link ReplayPolicy#CATCH_UP} that pass runs before the
 * mutation returns; a failure there still leaves the effect committed for any later
 * pass to apply.
 */
public class IndexCatalog implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(IndexCatalog.class);

    private final CatalogSchema schema;
    private final TableStore indexStore;
    private final TableStore walStore;
    private final WriteAheadLog wal;
    private final QueryEngine queryEngine;
    private final RecoveryEngine recoveryEngine;
    private final BackgroundRecovery backgroundRecovery;
    private final ReplayPolicy replayPolicy;
    private final AutoCloseable connection;

    public IndexCatalog(CatalogSchema schema, TableStore indexStore, TableStore walStore, ReplayPolicy replayPolicy) {
        this(schema, indexStore, walStore, new WriteAheadLog(walStore), replayPolicy, null);
    }

    public IndexCatalog(CatalogSchema schema, TableStore indexStore, TableStore walStore, WriteAheadLog wal,
                        ReplayPolicy replayPolicy) {
        this(schema, indexStore, walStore, wal, replayPolicy, null);
    }

    private IndexCatalog(CatalogSchema schema, TableStore indexStore, TableStore walStore, WriteAheadLog wal,
                         ReplayPolicy replayPolicy, AutoCloseable connection) {
        this.schema = schema;
        this.indexStore = indexStore;
        this.walStore = walStore;
        this.wal = wal;
        this.replayPolicy = replayPolicy;
        this.connection = connection;
        this.queryEngine = new QueryEngine(indexStore, schema);
        this.recoveryEngine = new RecoveryEngine(wal, new IndexPartitionWriter(indexStore, schema), schema);
        this.backgroundRecovery = new BackgroundRecovery(recoveryEngine);
    }

    /**
     * Opens an S3-backed catalog: provisions the bucket if needed, locks the schema
     * from the configured index keys and primary field, and starts background
     * recovery under {@link ReplayPolicy#DEFERRED}.
     */
    public static IndexCatalog open(CatalogConfig config) throws CatalogException {
        CatalogSchema schema = CatalogSchema.of(config.getIndexKeys(), config.getPrimaryField());
        S3Client client = S3TableStore.createClient(config);
        TableStore indexStore = new S3TableStore(client, config.getS3Bucket(), config.getTableName());
        TableStore walStore = new S3TableStore(client, config.getS3Bucket(), config.getWalTableName());

        IndexCatalog catalog = new IndexCatalog(schema, indexStore, walStore, new WriteAheadLog(walStore),
            config.getReplayPolicy(), client);
        try {
            indexStore.ensureTable();
            walStore.ensureTable();
        } catch (CatalogException e) {
            catalog.close();
            throw e;
        }

        if (config.getReplayPolicy() == ReplayPolicy.DEFERRED) {
            catalog.startBackgroundRecovery(config.getRecoveryInterval());
        }
        LOG.info("Catalog opened: table={}, wal={}, schema={}, replayPolicy={}",
            config.getTableName(), config.getWalTableName(), schema, config.getReplayPolicy());
        return catalog;
    }

    /**
     * Sets and locks the schema if it was not supplied at construction.
     */
    public void configure(List<String> indexKeys, String primaryField) throws CatalogException {
        schema.set(indexKeys, primaryField);
    }

    /**
     * Logs an insert and, under {@link ReplayPolicy#CATCH_UP}, applies it.
     *
     * @return the validated record
     * @throws ValidationException if the record lacks an index key or the primary field
     */
    public CatalogRecord insert(CatalogRecord record) throws CatalogException {
        schema.requireLocked();
        List<String> missing = record.missing(schema.requiredFields());
        if (!missing.isEmpty()) {
            throw new ValidationException(ErrorCode.MISSING_FIELDS,
                "insert: record is missing required fields: " + missing, missing);
        }

        wal.append(WalOperation.INSERT, record);
        afterMutation();
        return record;
    }

    public int delete(Map<String, String> filter) throws CatalogException {
        return delete(filter, RowBounds.none());
    }

    /**
     * Logs one delete per record currently matching {@code filter} and, under
     * {@link ReplayPolicy#CATCH_UP}, applies them.
     *
     * @return the number of records logged for deletion
     */
    public int delete(Map<String, String> filter, RowBounds bounds) throws CatalogException {
        schema.requireLocked();
        List<CatalogRecord> matches = queryEngine.query(filter, bounds);
        for (CatalogRecord record : matches) {
            wal.append(WalOperation.DELETE, record);
        }
        afterMutation();
        return matches.size();
    }

    public List<CatalogRecord> query(Map<String, String> filter) throws CatalogException {
        return queryEngine.query(filter, RowBounds.none());
    }

    public List<CatalogRecord> query(Map<String, String> filter, RowBounds bounds) throws CatalogException {
        return queryEngine.query(filter, bounds);
    }

    /**
     * Applies every WAL entry after the checkpoint.
     */
    public RecoveryResult recover() throws CatalogException {
        return recoveryEngine.recover();
    }

    /**
     * Applies every WAL entry after {@code startAfter}, regardless of the checkpoint.
     */
    public RecoveryResult recoverFrom(String startAfter) throws CatalogException {
        return recoveryEngine.recoverFrom(startAfter);
    }

    public void startBackgroundRecovery(Duration interval) {
        backgroundRecovery.start(interval);
    }

    public CatalogSchema getSchema() {
        return schema;
    }

    public ReplayPolicy getReplayPolicy() {
        return replayPolicy;
    }

    public WriteAheadLog getWal() {
        return wal;
    }

    public BackgroundRecovery getBackgroundRecovery() {
        return backgroundRecovery;
    }

    private void afterMutation() throws CatalogException {
        if (replayPolicy == ReplayPolicy.CATCH_UP) {
            recoveryEngine.recover();
        }
    }

    @Override
    public void close() {
        backgroundRecovery.close();
        indexStore.close();
        walStore.close();
        if (connection != null) {
            try {
                connection.close();
            } catch (Exception e) {
                LOG.warn("Error closing store connection: {}", e.getMessage());
            }
        }
    }
}
