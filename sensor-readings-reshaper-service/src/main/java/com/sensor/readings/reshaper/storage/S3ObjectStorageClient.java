package com.sensor.readings.reshaper.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.sensor.readings.reshaper.config.properties.S3ConfigurationProperties;
import com.sensor.readings.reshaper.dto.ObjectListing;
import com.sensor.readings.reshaper.exception.InvalidInputException;
import com.sensor.readings.reshaper.exception.ObjectNotFoundException;

import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * {@link ObjectStorageClient} backed by the AWS SDK v2 synchronous {@link S3Client}.
 *
 * <p>Downloads are streamed straight to disk so large readings files never sit in memory.
 */
@Service
public class S3ObjectStorageClient implements ObjectStorageClient {

    private static final Logger logger = LoggerFactory.getLogger(S3ObjectStorageClient.class);

    private final S3Client s3Client;
    private final S3ConfigurationProperties s3Config;

    public S3ObjectStorageClient(S3Client s3Client, S3ConfigurationProperties s3Config) {
        this.s3Client = s3Client;
        this.s3Config = s3Config;
        logger.info("S3 object storage client initialized for bucket '{}'", s3Config.bucket());
    }

    @Override
    public long download(String key, Path target) {
        GetObjectRequest getObjectRequest = GetObjectRequest.builder()
            .bucket(s3Config.bucket())
            .key(key)
            .build();

        try (ResponseInputStream<GetObjectResponse> responseStream = s3Client.getObject(getObjectRequest)) {
            validateFileSize(key, responseStream.response().contentLength());
            long bytes = Files.copy(responseStream, target, StandardCopyOption.REPLACE_EXISTING);
            logger.debug("Downloaded s3://{}/{} ({} bytes) to {}", s3Config.bucket(), key, bytes, target);
            return bytes;

        } catch (NoSuchKeyException e) {
            throw new ObjectNotFoundException("S3 object not found: " + key, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + key + " to " + target, e);
        }
    }

    @Override
    public void upload(String key, Path source) {
        PutObjectRequest putObjectRequest = PutObjectRequest.builder()
            .bucket(s3Config.bucket())
            .key(key)
            .build();

        s3Client.putObject(putObjectRequest, RequestBody.fromFile(source));
        logger.debug("Uploaded {} to s3://{}/{}", source, s3Config.bucket(), key);
    }

    @Override
    public void delete(String key) {
        s3Client.deleteObject(DeleteObjectRequest.builder()
            .bucket(s3Config.bucket())
            .key(key)
            .build());
        logger.debug("Deleted s3://{}/{}", s3Config.bucket(), key);
    }

    @Override
    public ObjectListing list(String prefix, String delimiter) {
        ListObjectsV2Request.Builder request = ListObjectsV2Request.builder()
            .bucket(s3Config.bucket())
            .prefix(prefix);
        if (delimiter != null) {
            request.delimiter(delimiter);
        }

        List<String> keys = new ArrayList<>();
        List<String> commonPrefixes = new ArrayList<>();
        for (ListObjectsV2Response page : s3Client.listObjectsV2Paginator(request.build())) {
            page.contents().stream().map(S3Object::key).forEach(keys::add);
            page.commonPrefixes().stream().map(CommonPrefix::prefix).forEach(commonPrefixes::add);
        }

        logger.debug("Listed s3://{}/{}: {} keys, {} prefixes",
            s3Config.bucket(), prefix, keys.size(), commonPrefixes.size());
        return new ObjectListing(keys, commonPrefixes);
    }

    private void validateFileSize(String key, Long contentLength) {
        if (contentLength != null && contentLength > s3Config.maxFileSize()) {
            throw new InvalidInputException(String.format(
                "Object %s is %d bytes, exceeds maximum allowed size %d bytes",
                key, contentLength, s3Config.maxFileSize()));
        }
    }
}
