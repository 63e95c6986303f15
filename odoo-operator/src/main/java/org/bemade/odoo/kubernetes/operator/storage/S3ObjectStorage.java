/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.AmazonClientException;
import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.transfer.Download;
import com.amazonaws.services.s3.transfer.Transfer;
import com.amazonaws.services.s3.transfer.TransferManager;
import com.amazonaws.services.s3.transfer.TransferManagerBuilder;
import com.amazonaws.services.s3.transfer.Upload;

import org.bemade.odoo.kubernetes.api.common.ObjectStorageLocation;

/**
 * {@link ObjectStorage} on S3 or an S3-compatible service. A client is built for each transfer from
 * the job's own credentials and shut down when the transfer ends.
 */
public class S3ObjectStorage implements ObjectStorage {

    private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStorage.class);

    static final String DEFAULT_REGION = "us-east-1";
    private static final long POLL_MILLIS = 250;

    private final Duration transferTimeout;
    private final Duration connectTimeout;

    /**
     * @param transferTimeout bound on a whole transfer
     * @param connectTimeout connection and socket timeout of the client
     */
    public S3ObjectStorage(Duration transferTimeout, Duration connectTimeout) {
        this.transferTimeout = Objects.requireNonNull(transferTimeout);
        this.connectTimeout = Objects.requireNonNull(connectTimeout);
    }

    @Override
    public void upload(ObjectStorageLocation location, ObjectStorageCredentials credentials, Path file) throws IOException, InterruptedException {
        TransferManager transferManager = transferManager(location, credentials);
        try {
            Upload upload = transferManager.upload(location.getBucket(), location.getKey(), file.toFile());
            await(upload, location);
            LOGGER.info("Uploaded {} to s3://{}/{}", file.getFileName(), location.getBucket(), location.getKey());
        }
        catch (AmazonClientException e) {
            throw new IOException("Upload to s3://" + location.getBucket() + "/" + location.getKey() + " failed: " + e.getMessage(), e);
        }
        finally {
            transferManager.shutdownNow(true);
        }
    }

    @Override
    public void download(ObjectStorageLocation location, ObjectStorageCredentials credentials, Path target) throws IOException, InterruptedException {
        TransferManager transferManager = transferManager(location, credentials);
        try {
            Download download = transferManager.download(location.getBucket(), location.getKey(), target.toFile());
            await(download, location);
            LOGGER.info("Downloaded s3://{}/{} to {}", location.getBucket(), location.getKey(), target.getFileName());
        }
        catch (AmazonClientException e) {
            throw new IOException("Download of s3://" + location.getBucket() + "/" + location.getKey() + " failed: " + e.getMessage(), e);
        }
        finally {
            transferManager.shutdownNow(true);
        }
    }

    private void await(Transfer transfer, ObjectStorageLocation location) throws IOException, InterruptedException {
        Instant deadline = Instant.now().plus(transferTimeout);
        try {
            while (!transfer.isDone()) {
                if (Instant.now().isAfter(deadline)) {
                    throw new IOException("Transfer of s3://" + location.getBucket() + "/" + location.getKey() + " timed out after " + transferTimeout);
                }
                Thread.sleep(POLL_MILLIS);
            }
            transfer.waitForCompletion();
        }
        catch (IOException | InterruptedException | AmazonClientException e) {
            abort(transfer, e);
            throw e;
        }
    }

    /**
     * A failure to abort is attached to {@code cause} as a suppressed exception.
     */
    static void abort(Transfer transfer, Exception cause) {
        try {
            if (transfer instanceof Upload upload) {
                upload.abort();
            }
            else if (transfer instanceof Download download) {
                download.abort();
            }
        }
        catch (IOException | AmazonClientException e) {
            LOGGER.warn("Unable to abort transfer: {}", e.getMessage());
            cause.addSuppressed(e);
        }
    }

    private TransferManager transferManager(ObjectStorageLocation location, ObjectStorageCredentials credentials) {
        String region = Optional.ofNullable(location.getRegion()).filter(r -> !r.isBlank()).orElse(DEFAULT_REGION);
        var clientConfiguration = new ClientConfiguration()
                .withConnectionTimeout((int) connectTimeout.toMillis())
                .withSocketTimeout((int) connectTimeout.toMillis());
        AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
                .withCredentials(new AWSStaticCredentialsProvider(new BasicAWSCredentials(credentials.accessKeyId(), credentials.secretAccessKey())))
                .withClientConfiguration(clientConfiguration)
                .withPathStyleAccessEnabled(Boolean.TRUE.equals(location.getPathStyleAccess()));
        if (location.getEndpoint() != null && !location.getEndpoint().isBlank()) {
            builder.withEndpointConfiguration(new AwsClientBuilder.EndpointConfiguration(location.getEndpoint(), region));
        }
        else {
            builder.withRegion(region);
        }
        AmazonS3 s3 = builder.build();
        return TransferManagerBuilder.standard().withS3Client(s3).build();
    }
}
