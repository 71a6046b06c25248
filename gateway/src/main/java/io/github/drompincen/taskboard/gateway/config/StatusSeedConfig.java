package io.github.drompincen.taskboard.gateway.config;

import io.github.drompincen.taskboard.runtime.status.StatusService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StatusSeedConfig {

    private static final Logger log = LoggerFactory.getLogger(StatusSeedConfig.class);

    @Bean
    ApplicationRunner statusSeeder(StatusService statusService,
                                   @Value("${taskboard.statuses.seed-defaults:true}") boolean seedDefaults) {
        return args -> {
            if (!seedDefaults) {
                log.info("Default status seeding disabled");
                return;
            }
            int inserted = statusService.seedDefaults();
            if (inserted > 0) {
                log.info("Inserted {} default statuses", inserted);
            }
        };
    }
}
