package com.xammer.tagops.service;

import com.xammer.tagops.domain.CloudProvider;
import com.xammer.tagops.domain.CloudResource;
import com.xammer.tagops.dto.DiscoveredResource;
import com.xammer.tagops.exception.ConnectorException;
import com.xammer.tagops.util.TagMaps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.InstanceStateName;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.FunctionConfiguration;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.DBInstance;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Bucket;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.Tagging;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * EC2 instances, S3 buckets, RDS instances and Lambda functions of one AWS account.
 */
@Service
@ConditionalOnProperty(prefix = "tagops.connectors.aws", name = "enabled", havingValue = "true")
public class AwsConnector implements CloudConnector {

    private static final Logger logger = LoggerFactory.getLogger(AwsConnector.class);

    static final String EC2 = "ec2";
    static final String S3 = "s3";
    static final String RDS = "rds";
    static final String LAMBDA = "lambda";
    static final String S3_ARN_PREFIX = "arn:aws:s3:::";

    private static final List<String> FALLBACK_REGIONS = List.of(
            "us-east-1", "us-east-2", "us-west-1", "us-west-2",
            "eu-west-1", "eu-central-1", "ap-south-1", "ap-southeast-1", "ap-northeast-1");

    private final AwsClientProvider clientProvider;
    private final TaskExecutor executor;
    private final String homeRegion;
    private final List<String> configuredRegions;

    public AwsConnector(AwsClientProvider clientProvider,
                        @Qualifier("connectorTaskExecutor") TaskExecutor executor,
                        @Value("${tagops.connectors.aws.region:us-east-1}") String homeRegion,
                        @Value("${tagops.connectors.aws.regions:}") String regions) {
        this.clientProvider = clientProvider;
        this.executor = executor;
        this.homeRegion = homeRegion;
        this.configuredRegions = Arrays.stream(regions.split(","))
                .map(String::trim)
                .filter(r -> !r.isEmpty())
                .collect(Collectors.toList());
    }

    @Override
    public CloudProvider provider() {
        return CloudProvider.AWS;
    }

    // --- LISTING ---

    @Override
    public List<DiscoveredResource> listResources() {
        List<String> regions = resolveRegions();
        logger.info("Listing AWS resources across {} region(s)", regions.size());

        List<CompletableFuture<List<DiscoveredResource>>> futures = regions.stream()
                .map(region -> CompletableFuture.supplyAsync(() -> listRegion(region), executor))
                .collect(Collectors.toList());

        List<DiscoveredResource> resources = new ArrayList<>(listBuckets());
        for (CompletableFuture<List<DiscoveredResource>> future : futures) {
            resources.addAll(future.join());
        }
        logger.info("Found {} AWS resource(s)", resources.size());
        return resources;
    }

    private List<String> resolveRegions() {
        if (!configuredRegions.isEmpty()) {
            return configuredRegions;
        }
        try {
            return clientProvider.getEc2Client(homeRegion).describeRegions().regions().stream()
                    .filter(region -> !"not-opted-in".equals(region.optInStatus()))
                    .map(software.amazon.awssdk.services.ec2.model.Region::regionName)
                    .collect(Collectors.toList());
        } catch (AwsServiceException | SdkClientException e) {
            logger.warn("Could not describe AWS regions ({}); using fallback list", e.getMessage());
            return FALLBACK_REGIONS;
        }
    }

    private List<DiscoveredResource> listRegion(String region) {
        List<DiscoveredResource> resources = new ArrayList<>();
        resources.addAll(safely("EC2", region, () -> listInstances(region)));
        resources.addAll(safely("RDS", region, () -> listDatabases(region)));
        resources.addAll(safely("Lambda", region, () -> listFunctions(region)));
        return resources;
    }

    private List<DiscoveredResource> safely(String service, String region, Supplier<List<DiscoveredResource>> call) {
        try {
            return call.get();
        } catch (AwsServiceException e) {
            logger.warn("{} listing failed in region {}: {}", service, region, e.awsErrorDetails().errorMessage());
        } catch (Exception e) {
            logger.error("{} listing failed in region {}", service, region, e);
        }
        return Collections.emptyList();
    }

    private List<DiscoveredResource> listInstances(String region) {
        Ec2Client ec2 = clientProvider.getEc2Client(region);
        List<DiscoveredResource> resources = new ArrayList<>();
        ec2.describeInstancesPaginator().reservations().forEach(reservation -> {
            for (Instance instance : reservation.instances()) {
                if (instance.state() != null && instance.state().name() == InstanceStateName.TERMINATED) {
                    continue;
                }
                Map<String, String> tags = new LinkedHashMap<>();
                instance.tags().forEach(t -> tags.put(t.key(), t.value()));
                resources.add(DiscoveredResource.builder()
                        .resourceId(instance.instanceId())
                        .name(tags.getOrDefault("Name", instance.instanceId()))
                        .resourceType(EC2)
                        .cloudProvider(CloudProvider.AWS)
                        .region(region)
                        .tags(tags)
                        .build());
            }
        });
        return resources;
    }

    private List<DiscoveredResource> listDatabases(String region) {
        RdsClient rds = clientProvider.getRdsClient(region);
        List<DiscoveredResource> resources = new ArrayList<>();
        for (DBInstance db : rds.describeDBInstancesPaginator().dbInstances()) {
            Map<String, String> tags = new LinkedHashMap<>();
            db.tagList().forEach(t -> tags.put(t.key(), t.value()));
            resources.add(DiscoveredResource.builder()
                    .resourceId(db.dbInstanceArn())
                    .name(db.dbInstanceIdentifier())
                    .resourceType(RDS)
                    .cloudProvider(CloudProvider.AWS)
                    .region(region)
                    .tags(tags)
                    .build());
        }
        return resources;
    }

    private List<DiscoveredResource> listFunctions(String region) {
        LambdaClient lambda = clientProvider.getLambdaClient(region);
        List<DiscoveredResource> resources = new ArrayList<>();
        for (FunctionConfiguration function : lambda.listFunctionsPaginator().functions()) {
            Map<String, String> tags = new LinkedHashMap<>();
            try {
                tags.putAll(lambda.listTags(r -> r.resource(function.functionArn())).tags());
            } catch (AwsServiceException e) {
                logger.warn("Could not read tags of Lambda {}: {}", function.functionName(), e.awsErrorDetails().errorMessage());
                continue;
            }
            resources.add(DiscoveredResource.builder()
                    .resourceId(function.functionArn())
                    .name(function.functionName())
                    .resourceType(LAMBDA)
                    .cloudProvider(CloudProvider.AWS)
                    .region(region)
                    .tags(tags)
                    .build());
        }
        return resources;
    }

    private List<DiscoveredResource> listBuckets() {
        List<DiscoveredResource> resources = new ArrayList<>();
        List<Bucket> buckets;
        try {
            buckets = clientProvider.getS3Client(homeRegion).listBuckets().buckets();
        } catch (AwsServiceException | SdkClientException e) {
            logger.warn("S3 bucket listing failed: {}", e.getMessage());
            return resources;
        }
        for (Bucket bucket : buckets) {
            try {
                String region = bucketRegion(bucket.name());
                resources.add(DiscoveredResource.builder()
                        .resourceId(S3_ARN_PREFIX + bucket.name())
                        .name(bucket.name())
                        .resourceType(S3)
                        .cloudProvider(CloudProvider.AWS)
                        .region(region)
                        .tags(bucketTags(clientProvider.getS3Client(region), bucket.name()))
                        .build());
            } catch (AwsServiceException | SdkClientException e) {
                logger.warn("Skipping bucket {}: {}", bucket.name(), e.getMessage());
            }
        }
        return resources;
    }

    private String bucketRegion(String bucket) {
        S3Client s3 = clientProvider.getS3Client(homeRegion);
        try {
            String location = s3.getBucketLocation(req -> req.bucket(bucket)).locationConstraintAsString();
            if (location == null || location.isEmpty()) {
                return "us-east-1";
            }
            return "EU".equals(location) ? "eu-west-1" : location;
        } catch (S3Exception e) {
            return e.awsErrorDetails().sdkHttpResponse().firstMatchingHeader("x-amz-bucket-region").orElse(homeRegion);
        }
    }

    private Map<String, String> bucketTags(S3Client s3, String bucket) {
        Map<String, String> tags = new LinkedHashMap<>();
        try {
            s3.getBucketTagging(req -> req.bucket(bucket)).tagSet().forEach(t -> tags.put(t.key(), t.value()));
        } catch (S3Exception e) {
            if (!"NoSuchTagSet".equals(e.awsErrorDetails().errorCode())) {
                throw e;
            }
        }
        return tags;
    }

    // --- TAGGING ---

    @Override
    public boolean updateResourceTags(CloudResource resource, Map<String, String> tags) {
        String resourceId = resource.getResourceId();
        String region = resource.getRegion() == null ? homeRegion : resource.getRegion();
        try {
            switch (resource.getResourceType()) {
                case EC2:
                    clientProvider.getEc2Client(region).createTags(r -> r
                            .resources(resourceId)
                            .tags(tags.entrySet().stream()
                                    .map(e -> software.amazon.awssdk.services.ec2.model.Tag.builder().key(e.getKey()).value(e.getValue()).build())
                                    .collect(Collectors.toList())));
                    break;
                case S3:
                    tagBucket(resourceId, region, tags);
                    break;
                case RDS:
                    clientProvider.getRdsClient(region).addTagsToResource(r -> r
                            .resourceName(resourceId)
                            .tags(tags.entrySet().stream()
                                    .map(e -> software.amazon.awssdk.services.rds.model.Tag.builder().key(e.getKey()).value(e.getValue()).build())
                                    .collect(Collectors.toList())));
                    break;
                case LAMBDA:
                    clientProvider.getLambdaClient(region).tagResource(r -> r.resource(resourceId).tags(tags));
                    break;
                default:
                    logger.warn("AWS resource type '{}' of {} does not support tagging", resource.getResourceType(), resourceId);
                    return false;
            }
        } catch (AwsServiceException e) {
            logger.error("AWS rejected tag update on {}: {}", resourceId, e.awsErrorDetails().errorMessage());
            return false;
        } catch (SdkClientException e) {
            throw new ConnectorException("AWS tag update on " + resourceId + " failed: " + e.getMessage(), e);
        }
        logger.info("Applied {} tag(s) to AWS {} {}", tags.size(), resource.getResourceType(), resourceId);
        return true;
    }

    // PutBucketTagging replaces the whole set, so merge with what is there first
    private void tagBucket(String resourceId, String region, Map<String, String> tags) {
        String bucket = resourceId.startsWith(S3_ARN_PREFIX) ? resourceId.substring(S3_ARN_PREFIX.length()) : resourceId;
        S3Client s3 = clientProvider.getS3Client(region);
        Map<String, String> merged = TagMaps.merge(bucketTags(s3, bucket), tags);
        s3.putBucketTagging(r -> r
                .bucket(bucket)
                .tagging(Tagging.builder()
                        .tagSet(merged.entrySet().stream()
                                .map(e -> software.amazon.awssdk.services.s3.model.Tag.builder().key(e.getKey()).value(e.getValue()).build())
                                .collect(Collectors.toList()))
                        .build()));
    }
}
