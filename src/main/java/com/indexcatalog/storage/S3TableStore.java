package com.indexcatalog.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.indexcatalog.config.CatalogConfig;
import com.indexcatalog.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link TableStore} on an S3 bucket: one JSON object per entity at
 * {@code {table}/{hex partition key}/{hex row key}}.
 * <p>
 * {@code create} and {@code replace} are conditional puts ({@code If-None-Match: *}
 * and {@code If-Match: etag}); a 412 or 409 answer means the condition lost.
 */
public class S3TableStore implements TableStore {
    private static final Logger LOG = LoggerFactory.getLogger(S3TableStore.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int PRECONDITION_FAILED = 412;
    private static final int CONFLICT = 409;
    private static final int NOT_FOUND = 404;

    private final S3Client s3Client;
    private final String bucketName;
    private final String tableName;

    /**
     * The client is shared between tables and closed by its owner, not by this store.
     */
    public S3TableStore(S3Client s3Client, String bucketName, String tableName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.tableName = tableName;
    }

    /**
     * Builds an S3 client for the configured region, pointing at the endpoint
     * override (LocalStack, MinIO) when one is set.
     */
    public static S3Client createClient(CatalogConfig config) {
        S3ClientBuilder builder = S3Client.builder()
            .region(Region.of(config.getS3Region()));

        config.getS3Endpoint().ifPresent(endpoint -> builder
            .endpointOverride(URI.create(endpoint))
            .credentialsProvider(StaticCredentialsProvider.create(
                AwsBasicCredentials.create("test", "test")))
            .forcePathStyle(true));

        return builder.build();
    }

    @Override
    public String getTableName() {
        return tableName;
    }

    @Override
    public void ensureTable() throws StoreException {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
        } catch (NoSuchBucketException e) {
            LOG.info("Bucket {} not found, creating it for table {}", bucketName, tableName);
            try {
                s3Client.createBucket(CreateBucketRequest.builder().bucket(bucketName).build());
            } catch (SdkException createFailure) {
                throw new StoreException("Failed to create bucket: " + bucketName, createFailure);
            }
        } catch (SdkException e) {
            throw new StoreException("Failed to check bucket: " + bucketName, e);
        }
    }

    @Override
    public StoreOutcome create(String partitionKey, String rowKey, Map<String, String> fields) throws StoreException {
        String key = S3ObjectKeys.objectKey(tableName, partitionKey, rowKey);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .ifNoneMatch("*")
                .contentType("application/json")
                .build();

            s3Client.putObject(request, RequestBody.fromBytes(serialize(fields)));
            return StoreOutcome.APPLIED;
        } catch (SdkServiceException e) {
            if (isConditionFailure(e)) {
                return StoreOutcome.ALREADY_EXISTS;
            }
            throw new StoreException("Failed to create object in S3: " + key, e);
        } catch (SdkException e) {
            throw new StoreException("Failed to create object in S3: " + key, e);
        }
    }

    @Override
    public void upsert(String partitionKey, String rowKey, Map<String, String> fields) throws StoreException {
        String key = S3ObjectKeys.objectKey(tableName, partitionKey, rowKey);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .contentType("application/json")
                .build();

            s3Client.putObject(request, RequestBody.fromBytes(serialize(fields)));
        } catch (SdkException e) {
            throw new StoreException("Failed to put object to S3: " + key, e);
        }
    }

    @Override
    public boolean replace(String partitionKey, String rowKey, Map<String, String> fields, String expectedEtag)
            throws StoreException {
        String key = S3ObjectKeys.objectKey(tableName, partitionKey, rowKey);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .ifMatch(expectedEtag)
                .contentType("application/json")
                .build();

            s3Client.putObject(request, RequestBody.fromBytes(serialize(fields)));
            return true;
        } catch (SdkServiceException e) {
            if (isConditionFailure(e) || e.statusCode() == NOT_FOUND) {
                return false;
            }
            throw new StoreException("Failed to replace object in S3: " + key, e);
        } catch (SdkException e) {
            throw new StoreException("Failed to replace object in S3: " + key, e);
        }
    }

    @Override
    public StoreOutcome delete(String partitionKey, String rowKey) throws StoreException {
        String key = S3ObjectKeys.objectKey(tableName, partitionKey, rowKey);
        try {
            // S3 deletes succeed on missing keys, so probe first to report NOT_FOUND
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucketName).key(key).build());
        } catch (NoSuchKeyException e) {
            return StoreOutcome.NOT_FOUND;
        } catch (SdkServiceException e) {
            if (e.statusCode() == NOT_FOUND) {
                return StoreOutcome.NOT_FOUND;
            }
            throw new StoreException("Failed to check object in S3: " + key, e);
        } catch (SdkException e) {
            throw new StoreException("Failed to check object in S3: " + key, e);
        }

        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(key).build());
            return StoreOutcome.APPLIED;
        } catch (SdkException e) {
            throw new StoreException("Failed to delete object from S3: " + key, e);
        }
    }

    @Override
    public Optional<TableEntity> get(String partitionKey, String rowKey) throws StoreException {
        String key = S3ObjectKeys.objectKey(tableName, partitionKey, rowKey);
        try {
            GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();

            ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(request);
            StoredBody body = deserialize(key, response.asByteArray());
            return Optional.of(new TableEntity(partitionKey, rowKey, body.getFields(),
                    response.response().eTag(), body.getTimestamp()));
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (SdkException e) {
            throw new StoreException("Failed to get object from S3: " + key, e);
        }
    }

    @Override
    public List<TableEntity> query(String partitionKey, RowRange range) throws StoreException {
        if (range.isEmpty()) {
            return List.of();
        }
        String prefix = S3ObjectKeys.partitionPrefix(tableName, partitionKey);
        String startAfter = null;
        if (range.getLower() != null) {
            startAfter = range.isLowerInclusive()
                ? S3ObjectKeys.startAfterInclusive(tableName, partitionKey, range.getLower())
                : S3ObjectKeys.startAfterExclusive(tableName, partitionKey, range.getLower());
        }

        List<TableEntity> entities = new ArrayList<>();
        String continuationToken = null;
        try {
            do {
                ListObjectsV2Request request = ListObjectsV2Request.builder()
                    .bucket(bucketName)
                    .prefix(prefix)
                    .startAfter(startAfter)
                    .continuationToken(continuationToken)
                    .build();

                ListObjectsV2Response response = s3Client.listObjectsV2(request);

                for (S3Object object : response.contents()) {
                    String rowKey = S3ObjectKeys.rowKeyOf(prefix, object.key());
                    if (!range.contains(rowKey)) {
                        // listing order is row order, so nothing further can match
                        if (range.isAbove(rowKey)) {
                            return entities;
                        }
                        continue;
                    }
                    // listed objects can be deleted before we fetch them
                    get(partitionKey, rowKey).ifPresent(entities::add);
                }

                continuationToken = Boolean.TRUE.equals(response.isTruncated())
                    ? response.nextContinuationToken()
                    : null;
            } while (continuationToken != null);

            return entities;
        } catch (SdkException e) {
            throw new StoreException("Failed to list partition " + partitionKey + " in table " + tableName, e);
        }
    }

    private static boolean isConditionFailure(SdkServiceException e) {
        return e.statusCode() == PRECONDITION_FAILED || e.statusCode() == CONFLICT;
    }

    private static byte[] serialize(Map<String, String> fields) throws StoreException {
        try {
            return objectMapper.writeValueAsBytes(new StoredBody(fields, System.currentTimeMillis()));
        } catch (IOException e) {
            throw new StoreException("Failed to serialize entity", e);
        }
    }

    private static StoredBody deserialize(String key, byte[] data) throws StoreException {
        try {
            return objectMapper.readValue(data, StoredBody.class);
        } catch (IOException e) {
            throw new StoreException("Corrupt entity body at " + key, e);
        }
    }

    /**
     * JSON layout of an object body.
     */
    static class StoredBody {
        private final Map<String, String> fields;
        private final long timestamp;

        @JsonCreator
        StoredBody(
                @JsonProperty("fields") Map<String, String> fields,
                @JsonProperty("timestamp") long timestamp) {
            this.fields = fields != null ? new LinkedHashMap<>(fields) : new LinkedHashMap<>();
            this.timestamp = timestamp;
        }

        @JsonProperty("fields")
        public Map<String, String> getFields() { return fields; }

        @JsonProperty("timestamp")
        public long getTimestamp() { return timestamp; }
    }
}
