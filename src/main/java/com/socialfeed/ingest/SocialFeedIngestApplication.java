package com.socialfeed.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableJpaRepositories(basePackages = "com.socialfeed.ingest.repository")
@EntityScan(basePackages = "com.socialfeed.ingest.model")
public class SocialFeedIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(SocialFeedIngestApplication.class, args);
    }
}
