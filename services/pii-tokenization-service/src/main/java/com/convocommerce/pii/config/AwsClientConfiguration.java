package com.convocommerce.pii.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.KmsClientBuilder;

import java.net.URI;

/**
 * AWS clients for the key service and the token table. Built once and shared;
 * the container closes them on shutdown.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AwsClientConfiguration {

    private final PiiTokenizationProperties properties;

    @Bean(destroyMethod = "close")
    public KmsClient kmsClient() {
        KmsClientBuilder builder = KmsClient.builder()
                .region(Region.of(properties.getAws().getRegion()))
                .credentialsProvider(DefaultCredentialsProvider.create());
        String endpoint = properties.getAws().getEndpointOverride();
        if (StringUtils.hasText(endpoint)) {
            builder.endpointOverride(URI.create(endpoint));
        }
        log.info("KMS client configured for region {}", properties.getAws().getRegion());
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    public DynamoDbClient dynamoDbClient() {
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(properties.getAws().getRegion()))
                .credentialsProvider(DefaultCredentialsProvider.create());
        String endpoint = properties.getAws().getEndpointOverride();
        if (StringUtils.hasText(endpoint)) {
            builder.endpointOverride(URI.create(endpoint));
        }
        log.info("DynamoDB client configured for region {}, table {}",
                properties.getAws().getRegion(), properties.getTokenStore().getTableName());
        return builder.build();
    }
}
