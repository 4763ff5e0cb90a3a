package dev.minutes.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Object storage connection settings bound from {@code minutes.storage.*}.
 *
 * @param region AWS region of the bucket
 * @param endpoint optional endpoint override for S3-compatible stores such as MinIO
 * @param pathStyleAccess whether to address buckets by path instead of virtual host
 */
@ConfigurationProperties(prefix = "minutes.storage")
public record StorageProperties(String region, String endpoint, boolean pathStyleAccess) {}
