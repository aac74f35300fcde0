package org.dataworks.coalescence.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Everything needed to open a store client from scratch, so that it can be handed to another process.
 *
 * @param kind which store implementation to open
 * @param bucket the bucket holding the objects
 * @param region the AWS region, ignored for {@link Kind#FILE}
 * @param location the endpoint for {@link Kind#LOCALSTACK}, the root directory for {@link Kind#FILE}
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObjectStoreSettings(
    @JsonProperty("kind") Kind kind,
    @JsonProperty("bucket") String bucket,
    @JsonProperty("region") String region,
    @JsonProperty("location") String location
) {
    public static final String DEFAULT_REGION = "eu-west-2";
    public static final String DEFAULT_LOCALSTACK_ENDPOINT = "http://localhost:4566";

    public enum Kind {
        S3,
        LOCALSTACK,
        FILE
    }

    public ObjectStoreSettings {
        if (kind == null) {
            throw new IllegalArgumentException("Store kind is required");
        }
        if (bucket == null || bucket.isBlank()) {
            throw new IllegalArgumentException("Bucket name cannot be null or empty");
        }
        if (kind == Kind.FILE && (location == null || location.isBlank())) {
            throw new IllegalArgumentException("A root directory is required for a file store");
        }
    }

    public String regionOrDefault() {
        return region != null ? region : DEFAULT_REGION;
    }

    public String endpointOrDefault() {
        return location != null ? location : DEFAULT_LOCALSTACK_ENDPOINT;
    }
}
