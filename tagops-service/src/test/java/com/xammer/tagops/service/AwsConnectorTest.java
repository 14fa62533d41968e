package com.xammer.tagops.service;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.dto.DiscoveredResource;
import com.xammer.tagops.exception.ConnectorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.task.SyncTaskExecutor;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.CreateTagsRequest;
import software.amazon.awssdk.services.ec2.model.Ec2Exception;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Bucket;
import software.amazon.awssdk.services.s3.model.GetBucketLocationResponse;
import software.amazon.awssdk.services.s3.model.GetBucketTaggingResponse;
import software.amazon.awssdk.services.s3.model.ListBucketsResponse;
import software.amazon.awssdk.services.s3.model.PutBucketTaggingRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.Tag;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class AwsConnectorTest {

    private AwsClientProvider clientProvider;
    private Ec2Client ec2;
    private S3Client s3;
    private AwsConnector connector;

    @BeforeEach
    void setUp() {
        clientProvider = mock(AwsClientProvider.class);
        ec2 = mock(Ec2Client.class);
        s3 = mock(S3Client.class);
        when(clientProvider.getEc2Client(anyString())).thenReturn(ec2);
        when(clientProvider.getS3Client(anyString())).thenReturn(s3);
        connector = new AwsConnector(clientProvider, new SyncTaskExecutor(), "us-east-1", "eu-west-2");
    }

    @Test
    void instanceTagsAreWrittenWithCreateTags() {
        boolean applied = connector.updateResourceTags(resource("i-0abc", "ec2"), Map.of("Owner", "alice"));

        assertThat(applied).isTrue();
        ArgumentCaptor<Consumer<CreateTagsRequest.Builder>> captor = ArgumentCaptor.forClass(Consumer.class);
        verify(ec2).createTags(captor.capture());
        CreateTagsRequest.Builder builder = CreateTagsRequest.builder();
        captor.getValue().accept(builder);
        CreateTagsRequest request = builder.build();
        assertThat(request.resources()).containsExactly("i-0abc");
        assertThat(request.tags()).extracting(t -> t.key() + "=" + t.value()).containsExactly("Owner=alice");
    }

    @Test
    void bucketTaggingMergesWithExistingTagSet() {
        when(s3.getBucketTagging(any(Consumer.class))).thenReturn(GetBucketTaggingResponse.builder()
                .tagSet(Tag.builder().key("Team").value("data").build(), Tag.builder().key("Owner").value("old").build())
                .build());

        boolean applied = connector.updateResourceTags(resource("arn:aws:s3:::logs", "s3"), Map.of("Owner", "alice"));

        assertThat(applied).isTrue();
        ArgumentCaptor<Consumer<PutBucketTaggingRequest.Builder>> captor = ArgumentCaptor.forClass(Consumer.class);
        verify(s3).putBucketTagging(captor.capture());
        PutBucketTaggingRequest.Builder builder = PutBucketTaggingRequest.builder();
        captor.getValue().accept(builder);
        PutBucketTaggingRequest request = builder.build();
        assertThat(request.bucket()).isEqualTo("logs");
        assertThat(request.tagging().tagSet()).extracting(t -> t.key() + "=" + t.value())
                .containsExactlyInAnyOrder("Team=data", "Owner=alice");
    }

    @Test
    void serviceRejectionReturnsFalse() {
        when(ec2.createTags(any(Consumer.class))).thenThrow(Ec2Exception.builder()
                .message("UnauthorizedOperation")
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("UnauthorizedOperation").errorMessage("denied").build())
                .build());

        assertThat(connector.updateResourceTags(resource("i-0abc", "ec2"), Map.of("Owner", "alice"))).isFalse();
    }

    @Test
    void clientFailureIsAConnectorError() {
        when(ec2.createTags(any(Consumer.class))).thenThrow(SdkClientException.create("connection reset"));

        assertThatThrownBy(() -> connector.updateResourceTags(resource("i-0abc", "ec2"), Map.of("Owner", "alice")))
                .isInstanceOf(ConnectorException.class)
                .hasMessageContaining("connection reset");
    }

    @Test
    void unsupportedTypeIsNotTagged() {
        assertThat(connector.updateResourceTags(resource("arn:aws:sqs:q", "sqs"), Map.of("Owner", "alice"))).isFalse();
    }

    @Test
    void listingKeepsBucketsWhenRegionalServicesFail() {
        when(clientProvider.getRdsClient(anyString())).thenThrow(SdkClientException.create("no route"));
        when(clientProvider.getLambdaClient(anyString())).thenThrow(SdkClientException.create("no route"));
        when(ec2.describeInstancesPaginator()).thenThrow(SdkClientException.create("no route"));
        when(s3.listBuckets()).thenReturn(ListBucketsResponse.builder()
                .buckets(Bucket.builder().name("logs").build())
                .build());
        when(s3.getBucketLocation(any(Consumer.class))).thenReturn(GetBucketLocationResponse.builder()
                .locationConstraint("eu-west-2")
                .build());
        when(s3.getBucketTagging(any(Consumer.class))).thenThrow(S3Exception.builder()
                .message("The TagSet does not exist")
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("NoSuchTagSet").build())
                .build());

        List<DiscoveredResource> resources = connector.listResources();

        assertThat(resources).hasSize(1);
        DiscoveredResource bucket = resources.get(0);
        assertThat(bucket.getResourceId()).isEqualTo("arn:aws:s3:::logs");
        assertThat(bucket.getRegion()).isEqualTo("eu-west-2");
        assertThat(bucket.getTags()).isEmpty();
        assertThat(bucket.getCloudProvider()).isEqualTo(CloudProvider.AWS);
    }

    private static CloudResource resource(String id, String type) {
        return new CloudResource(id, id, type, CloudProvider.AWS, "eu-west-2");
    }
}
