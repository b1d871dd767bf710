package com.telesync.shared.config;

public record StorageConfig(
    String backend,
    String localRoot,
    S3 s3,
    Supabase supabase
) {
    public record S3(String accessKey, String secretKey, String bucket, String region, String endpoint) {
        public static S3 defaults() {
            return new S3("", "", "telesync-files", "us-east-1", "");
        }
    }

    public record Supabase(String url, String key, String bucket) {
        public static Supabase defaults() {
            return new Supabase("", "", "telesync-files");
        }
    }

    public static StorageConfig defaults() {
        return new StorageConfig(
            "local",
            System.getProperty("user.home") + "/.telesync/storage",
            S3.defaults(),
            Supabase.defaults()
        );
    }
}
