package com.voiceledger.categorizer.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

@Configuration
public class AwsClientConfig {

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "categorizer.index", name = "type", havingValue = "s3")
  public S3Client vectorIndexS3Client(ApplicationProperties properties) {
    return S3Client.builder()
        .region(Region.of(properties.getIndex().getRegion()))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }
}
