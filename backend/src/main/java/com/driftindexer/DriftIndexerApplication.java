package com.driftindexer;

import com.driftindexer.ingestion.job.IndexerLauncher;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class DriftIndexerApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(DriftIndexerApplication.class, args);
        int status = context.getBean(IndexerLauncher.class).awaitTermination();
        System.exit(SpringApplication.exit(context, () -> status));
    }
}
