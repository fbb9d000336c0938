package com.socialfeed.ingest;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:socialfeed;DB_CLOSE_DELAY=-1",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "apify.token=test-token",
        "app.ingestion.sweep.enabled=false",
        "logging.file.name="
})
class SocialFeedIngestApplicationTests {

    @Test
    void contextLoads() {
        // Ensures the application context starts with the default enrichment provider.
    }
}
