package com.example.backupstorage.storage;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.backupstorage.common.OperationCancelledException;
import com.example.backupstorage.common.OperationContext;
import com.example.backupstorage.storage.Storage.RetryPolicy;
import com.example.backupstorage.storage.Storage.S3Connector;
import com.example.backupstorage.storage.StorageConfig.S3Settings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

class S3ConnectorTest {

    private static final RetryPolicy FAST = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(2));

    private S3Client client;
    private S3Connector connector;
    private final OperationContext ctx = OperationContext.none();

    @BeforeEach
    void setUp() {
        client = mock(S3Client.class);
        S3Settings settings = new S3Settings("bk-bucket", "us-east-1", "backups/", null, "AKIA", "secret", null);
        connector = new S3Connector(settings, client, FAST);
    }

    @Test
    void put_sends_bucket_key_and_metadata() throws Exception {
        when(client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().build());

        connector.put("backups/a/metadata.json", "{}".getBytes(StandardCharsets.UTF_8),
                Map.of("backup-id", "a"), ctx);

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(client).putObject(captor.capture(), any(RequestBody.class));
        PutObjectRequest request = captor.getValue();
        assertEquals("bk-bucket", request.bucket());
        assertEquals("backups/a/metadata.json", request.key());
        assertEquals("application/json", request.contentType());
        assertEquals("a", request.metadata().get("backup-id"));
        assertEquals(2L, request.contentLength());
    }

    @Test
    void server_errors_are_retried_until_success() throws Exception {
        S3Exception unavailable = (S3Exception) S3Exception.builder().statusCode(503).message("Slow Down").build();
        when(client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(unavailable)
                .thenThrow(unavailable)
                .thenReturn(PutObjectResponse.builder().build());

        connector.put("backups/a/backup.json", new byte[] {1}, Map.of(), ctx);

        verify(client, times(3)).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }

    @Test
    void client_errors_fail_without_retry() {
        S3Exception forbidden = (S3Exception) S3Exception.builder().statusCode(403).message("Access Denied").build();
        when(client.putObject(any(PutObjectRequest.class), any(RequestBody.class))).thenThrow(forbidden);

        IOException e = assertThrows(IOException.class,
                () -> connector.put("backups/a/backup.json", new byte[] {1}, Map.of(), ctx));

        assertTrue(e.getMessage().contains("Access Denied"));
        verify(client, times(1)).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }

    @Test
    void retries_stop_at_max_attempts() {
        S3Exception unavailable = (S3Exception) S3Exception.builder().statusCode(500).message("Internal").build();
        when(client.putObject(any(PutObjectRequest.class), any(RequestBody.class))).thenThrow(unavailable);

        assertThrows(IOException.class, () -> connector.put("k", new byte[] {1}, Map.of(), ctx));

        verify(client, times(3)).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }

    @Test
    void missing_key_reads_as_empty() throws Exception {
        when(client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("no such key").build());

        assertFalse(connector.get("backups/ghost/metadata.json", ctx).isPresent());
    }

    @Test
    void get_returns_object_bytes() throws Exception {
        byte[] body = "payload".getBytes(StandardCharsets.UTF_8);
        when(client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), body));

        assertArrayEquals(body, connector.get("backups/a/backup.json", ctx).orElseThrow());
    }

    @Test
    void list_keys_follows_continuation_tokens() throws Exception {
        ListObjectsV2Response first = ListObjectsV2Response.builder()
                .contents(S3Object.builder().key("backups/a/metadata.json").build())
                .isTruncated(true)
                .nextContinuationToken("page-2")
                .build();
        ListObjectsV2Response second = ListObjectsV2Response.builder()
                .contents(S3Object.builder().key("backups/b/metadata.json").build())
                .isTruncated(false)
                .build();
        when(client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(first, second);

        List<String> keys = connector.listKeys("backups/", ctx);

        assertEquals(List.of("backups/a/metadata.json", "backups/b/metadata.json"), keys);
        ArgumentCaptor<ListObjectsV2Request> captor = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(client, times(2)).listObjectsV2(captor.capture());
        assertEquals("page-2", captor.getAllValues().get(1).continuationToken());
    }

    @Test
    void ping_heads_bucket_and_lists_one_key() throws Exception {
        when(client.headBucket(any(HeadBucketRequest.class))).thenReturn(HeadBucketResponse.builder().build());
        when(client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder().build());

        connector.ping(ctx);

        ArgumentCaptor<ListObjectsV2Request> captor = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(client).listObjectsV2(captor.capture());
        assertEquals(1, captor.getValue().maxKeys());
    }

    @Test
    void cancelled_context_never_reaches_the_client() {
        OperationContext cancelled = OperationContext.none();
        cancelled.cancel();

        assertThrows(OperationCancelledException.class, () -> connector.ping(cancelled));
        verify(client, never()).headBucket(any(HeadBucketRequest.class));
    }

    @Test
    void location_and_description_use_bucket() {
        assertEquals("s3://bk-bucket/backups/a/", connector.location("backups/a/"));
        assertEquals("us-east-1", connector.describe().get("region"));
    }
}
