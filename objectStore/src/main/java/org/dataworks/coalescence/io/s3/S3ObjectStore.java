package org.dataworks.coalescence.io.s3;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.dataworks.coalescence.io.ObjectLister;
import org.dataworks.coalescence.io.ObjectStore;
import org.dataworks.coalescence.io.ObjectSummary;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.Delete;
import software.amazon.awssdk.services.s3.model.DeleteObjectsRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectsResponse;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.ObjectIdentifier;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Error;

/**
 * ObjectStore implementation for Amazon S3 access, bound to one bucket.
 */
@Slf4j
public class S3ObjectStore implements ObjectStore {

    /** The most keys a single DeleteObjects call accepts. */
    static final int MAX_KEYS_PER_DELETE = 1000;

    private static final String LOCALSTACK_ACCESS_KEY = "accessKeyId";
    private static final String LOCALSTACK_SECRET_KEY = "secretAccessKey";

    private final S3AsyncClient s3Client;
    private final String bucketName;

    /**
     * Wrap an existing client
     * @param s3Client the client, closed along with this store
     * @param bucketName the bucket holding the objects
     */
    public S3ObjectStore(S3AsyncClient s3Client, String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
    }

    /**
     * Create a store against AWS, using the default credentials chain
     * @param bucketName the bucket holding the objects
     * @param region the AWS region
     */
    public static S3ObjectStore forAws(String bucketName, String region) {
        var client = S3AsyncClient.builder()
            .region(Region.of(region))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .build();
        return new S3ObjectStore(client, bucketName);
    }

    /**
     * Create a store against a LocalStack instance
     * @param bucketName the bucket holding the objects
     * @param region the region LocalStack emulates
     * @param endpoint the LocalStack endpoint
     */
    public static S3ObjectStore forLocalstack(String bucketName, String region, URI endpoint) {
        log.info("Targeting LocalStack at {}", endpoint);
        var client = S3AsyncClient.builder()
            .region(Region.of(region))
            .endpointOverride(endpoint)
            .forcePathStyle(true)
            .credentialsProvider(StaticCredentialsProvider.create(
                AwsBasicCredentials.create(LOCALSTACK_ACCESS_KEY, LOCALSTACK_SECRET_KEY)))
            .build();
        return new S3ObjectStore(client, bucketName);
    }

    @Override
    public byte[] read(String key) throws IOException {
        log.debug("Downloading S3 object: s3://{}/{}", bucketName, key);

        GetObjectRequest request = GetObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .build();

        try {
            return s3Client.getObject(request, AsyncResponseTransformer.toBytes()).join().asByteArray();
        } catch (RuntimeException e) {
            throw new IOException("Failed to get S3 object: " + location(key), e);
        }
    }

    @Override
    public void writeMerged(String key, List<byte[]> orderedContents) throws IOException {
        ByteArrayOutputStream merged = new ByteArrayOutputStream();
        for (byte[] content : orderedContents) {
            merged.write(content);
        }
        byte[] body = merged.toByteArray();

        log.debug("Uploading {} bytes to {}", body.length, location(key));
        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .contentLength((long) body.length)
            .build();

        try {
            s3Client.putObject(request, AsyncRequestBody.fromBytes(body)).join();
        } catch (RuntimeException e) {
            throw new IOException("Failed to put S3 object: " + location(key), e);
        }
    }

    @Override
    public void delete(List<String> keys) throws IOException {
        for (int from = 0; from < keys.size(); from += MAX_KEYS_PER_DELETE) {
            List<String> chunk = keys.subList(from, Math.min(from + MAX_KEYS_PER_DELETE, keys.size()));
            deleteChunk(chunk);
        }
    }

    private void deleteChunk(List<String> keys) throws IOException {
        List<ObjectIdentifier> identifiers = keys.stream()
            .map(key -> ObjectIdentifier.builder().key(key).build())
            .collect(Collectors.toList());
        DeleteObjectsRequest request = DeleteObjectsRequest.builder()
            .bucket(bucketName)
            .delete(Delete.builder().objects(identifiers).quiet(true).build())
            .build();

        DeleteObjectsResponse response;
        try {
            response = s3Client.deleteObjects(request).join();
        } catch (RuntimeException e) {
            throw new IOException("Failed to delete " + keys.size() + " S3 objects from s3://" + bucketName, e);
        }

        if (response.hasErrors() && !response.errors().isEmpty()) {
            List<String> failures = new ArrayList<>();
            for (S3Error error : response.errors()) {
                failures.add(error.key() + " (" + error.code() + ": " + error.message() + ")");
            }
            throw new IOException("Failed to delete S3 objects from s3://" + bucketName + ": " + failures);
        }
    }

    @Override
    public Flux<List<ObjectSummary>> listTranches(String prefix, int pageSize) {
        ObjectLister.checkPageSize(pageSize);
        return listPage(prefix, null)
            .expand(response -> Boolean.TRUE.equals(response.isTruncated())
                ? listPage(prefix, response.nextContinuationToken())
                : Mono.empty())
            .flatMapIterable(ListObjectsV2Response::contents)
            .map(s3Object -> new ObjectSummary(s3Object.key(), s3Object.size()))
            .buffer(pageSize);
    }

    private Mono<ListObjectsV2Response> listPage(String prefix, String continuationToken) {
        ListObjectsV2Request request = ListObjectsV2Request.builder()
            .bucket(bucketName)
            .prefix(prefix)
            .continuationToken(continuationToken)
            .build();

        return Mono.fromFuture(() -> s3Client.listObjectsV2(request))
            .doOnNext(response -> log.debug("Listed {} objects under {}", response.keyCount(), location(prefix)))
            .onErrorMap(e -> new IOException("Failed to list S3 objects with prefix: " + location(prefix), e));
    }

    private String location(String key) {
        return "s3://" + bucketName + "/" + key;
    }

    /**
     * Close the S3 client and release resources
     */
    @Override
    public void close() {
        if (s3Client != null) {
            s3Client.close();
        }
    }
}
