package com.xammer.tagops.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.auth.StsAssumeRoleCredentialsProvider;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Regional AWS clients for the scanned account. Credentials come from the default chain, or from an
 * assumed role when {@code tagops.connectors.aws.role-arn} is set.
 */
@Service
@ConditionalOnProperty(prefix = "tagops.connectors.aws", name = "enabled", havingValue = "true")
public class AwsClientProvider {

    private static final Logger logger = LoggerFactory.getLogger(AwsClientProvider.class);

    private final AwsCredentialsProvider credentialsProvider;
    private final ClientOverrideConfiguration overrideConfiguration;
    private final Map<String, SdkClient> clientCache = new ConcurrentHashMap<>();

    public AwsClientProvider(StsClient stsClient,
                             @Value("${tagops.connectors.aws.role-arn:}") String roleArn,
                             @Value("${tagops.connectors.aws.external-id:}") String externalId,
                             @Value("${tagops.connectors.timeout-seconds:30}") long timeoutSeconds) {
        this.credentialsProvider = buildCredentialsProvider(stsClient, roleArn, externalId);
        this.overrideConfiguration = ClientOverrideConfiguration.builder()
                .apiCallTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
        logger.info("AwsClientProvider initialized (assume role: {}, call timeout: {}s)",
                roleArn.isBlank() ? "no" : roleArn, timeoutSeconds);
    }

    private AwsCredentialsProvider buildCredentialsProvider(StsClient stsClient, String roleArn, String externalId) {
        if (roleArn == null || roleArn.isBlank()) {
            return DefaultCredentialsProvider.create();
        }
        return StsAssumeRoleCredentialsProvider.builder()
                .stsClient(stsClient)
                .refreshRequest(req -> {
                    req.roleArn(roleArn).roleSessionName("tagops-session");
                    if (externalId != null && !externalId.isBlank()) {
                        req.externalId(externalId);
                    }
                })
                .build();
    }

    public Ec2Client getEc2Client(String region) {
        return getClient(Ec2Client.class, Ec2Client.builder(), region);
    }

    public S3Client getS3Client(String region) {
        return getClient(S3Client.class, S3Client.builder(), region);
    }

    public RdsClient getRdsClient(String region) {
        return getClient(RdsClient.class, RdsClient.builder(), region);
    }

    public LambdaClient getLambdaClient(String region) {
        return getClient(LambdaClient.class, LambdaClient.builder(), region);
    }

    private <BuilderT extends AwsClientBuilder<BuilderT, ClientT>, ClientT extends SdkClient> ClientT getClient(
            Class<ClientT> clientClass, BuilderT builder, String region) {
        String key = clientClass.getSimpleName() + ":" + region;
        SdkClient client = clientCache.computeIfAbsent(key, k -> {
            logger.debug("Creating {} in region {}", clientClass.getSimpleName(), region);
            return builder
                    .credentialsProvider(credentialsProvider)
                    .region(Region.of(region))
                    .overrideConfiguration(overrideConfiguration)
                    .build();
        });
        return clientClass.cast(client);
    }
}
