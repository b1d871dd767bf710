package com.telesync.storage;

import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.telesync.shared.config.StorageConfig;

import java.io.ByteArrayInputStream;

public class S3Storage extends AbstractStorageAdapter {

    private final AmazonS3 s3;
    private final String bucket;

    public S3Storage(AmazonS3 s3, String bucket, MetadataIndex index) {
        super(index);
        this.s3 = s3;
        this.bucket = bucket;
    }

    public static AmazonS3 buildClient(StorageConfig.S3 cfg) {
        var builder = AmazonS3ClientBuilder.standard()
                .withCredentials(new AWSStaticCredentialsProvider(
                        new BasicAWSCredentials(cfg.accessKey(), cfg.secretKey())));
        if (cfg.endpoint() != null && !cfg.endpoint().isBlank()) {
            builder.withEndpointConfiguration(new AwsClientBuilder.EndpointConfiguration(cfg.endpoint(), cfg.region()))
                    .withPathStyleAccessEnabled(true);
        } else {
            builder.withRegion(cfg.region());
        }
        return builder.build();
    }

    @Override
    public String backend() {
        return "s3";
    }

    @Override
    protected void writeObject(String storagePath, byte[] bytes, String contentType) {
        var meta = new ObjectMetadata();
        meta.setContentLength(bytes.length);
        if (contentType != null) meta.setContentType(contentType);
        s3.putObject(bucket, storagePath, new ByteArrayInputStream(bytes), meta);
    }

    @Override
    protected byte[] readObject(String storagePath) throws Exception {
        try (var object = s3.getObject(bucket, storagePath);
             var in = object.getObjectContent()) {
            return in.readAllBytes();
        }
    }

    @Override
    protected void deleteObject(String storagePath) {
        s3.deleteObject(bucket, storagePath);
    }

    @Override
    public boolean isReachable() {
        try {
            return s3.doesBucketExistV2(bucket);
        } catch (RuntimeException e) {
            return false;
        }
    }
}
