package com.cred.freestyle.registration.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.time.Duration;
import java.util.Map;

/**
 * CloudWatch metrics configuration.
 * Publishes registration and payment metrics to AWS CloudWatch.
 * When disabled, Spring Boot's default simple registry collects the same meters locally.
 *
 * @author Registration Team
 */
@Configuration
@ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true", matchIfMissing = true)
public class CloudWatchConfig {

    @Value("${cloud.aws.region:ap-northeast-2}")
    private String awsRegion;

    @Value("${cloud.aws.cloudwatch.namespace:OfferingRegistration}")
    private String namespace;

    @Value("${cloud.aws.cloudwatch.batch-size:20}")
    private Integer batchSize;

    @Value("${cloud.aws.cloudwatch.step:PT1M}")
    private String step; // ISO-8601 duration

    @Bean
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * CloudWatch meter registry backing {@code CloudWatchMetricsService}.
     *
     * @param cloudWatchAsyncClient CloudWatch client
     * @return MeterRegistry
     */
    @Bean
    public MeterRegistry meterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        io.micrometer.cloudwatch2.CloudWatchConfig cloudWatchConfig = new io.micrometer.cloudwatch2.CloudWatchConfig() {
            private final Map<String, String> configuration = Map.of(
                    "cloudwatch.namespace", namespace,
                    "cloudwatch.batchSize", String.valueOf(batchSize),
                    "cloudwatch.step", step
            );

            @Override
            public String get(String key) {
                return configuration.get(key);
            }

            @Override
            public String namespace() {
                return namespace;
            }

            @Override
            public int batchSize() {
                return batchSize;
            }

            @Override
            public Duration step() {
                return Duration.parse(step);
            }
        };

        return new CloudWatchMeterRegistry(cloudWatchConfig, Clock.SYSTEM, cloudWatchAsyncClient);
    }
}
