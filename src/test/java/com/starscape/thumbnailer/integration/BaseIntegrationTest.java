package com.starscape.thumbnailer.integration;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.CreateQueueRequest;

import static org.testcontainers.containers.localstack.LocalStackContainer.Service.S3;
import static org.testcontainers.containers.localstack.LocalStackContainer.Service.SQS;

/**
 * Base class for integration tests.
 * Runs LocalStack (S3 + SQS) and points the application at it. Skipped when Docker is not available.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseIntegrationTest {

    @Container
    public static LocalStackContainer localstack = new LocalStackContainer(
            DockerImageName.parse("localstack/localstack:3.8"))
            .withServices(S3, SQS);

    protected static final String TEST_BUCKET = "test-bucket";
    protected static final String TEST_QUEUE_NAME = "thumbnail-jobs";

    protected static S3Client s3Client;
    protected static SqsClient sqsClient;
    protected static String queueUrl;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        // AWS configuration for LocalStack
        registry.add("aws.region", () -> localstack.getRegion());
        registry.add("spring.cloud.aws.region.static", () -> localstack.getRegion());
        registry.add("spring.cloud.aws.credentials.access-key", () -> localstack.getAccessKey());
        registry.add("spring.cloud.aws.credentials.secret-key", () -> localstack.getSecretKey());
        registry.add("spring.cloud.aws.sqs.endpoint", () -> localstack.getEndpointOverride(SQS).toString());
        registry.add("spring.cloud.aws.sqs.enabled", () -> "true");

        AwsBasicCredentials credentials = AwsBasicCredentials.create(
                localstack.getAccessKey(),
                localstack.getSecretKey()
        );

        s3Client = S3Client.builder()
                .endpointOverride(localstack.getEndpointOverride(S3))
                .credentialsProvider(StaticCredentialsProvider.create(credentials))
                .region(Region.of(localstack.getRegion()))
                .forcePathStyle(true)
                .build();

        sqsClient = SqsClient.builder()
                .endpointOverride(localstack.getEndpointOverride(SQS))
                .credentialsProvider(StaticCredentialsProvider.create(credentials))
                .region(Region.of(localstack.getRegion()))
                .build();

        try {
            s3Client.createBucket(CreateBucketRequest.builder()
                    .bucket(TEST_BUCKET)
                    .build());
        } catch (BucketAlreadyOwnedByYouException e) {
            // created by an earlier test class sharing the container
        }

        queueUrl = sqsClient.createQueue(CreateQueueRequest.builder()
                .queueName(TEST_QUEUE_NAME)
                .build()).queueUrl();
        registry.add("aws.sqs.queue-url", () -> queueUrl);
    }

    /**
     * Upload a file to LocalStack S3.
     */
    protected void uploadToS3(String key, byte[] content, String contentType) {
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(TEST_BUCKET)
                .key(key)
                .contentType(contentType)
                .build();

        s3Client.putObject(putRequest, RequestBody.fromBytes(content));
    }

    protected boolean existsInS3(String key) {
        try {
            s3Client.headObject(b -> b.bucket(TEST_BUCKET).key(key));
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (software.amazon.awssdk.services.s3.model.S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw e;
        }
    }
}
