package io.github.drompincen.fieldsync.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.fieldsync")
@EnableMongoRepositories(basePackages = "io.github.drompincen.fieldsync.persistence.repository")
@EnableScheduling
public class FieldSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(FieldSyncApplication.class, args);
    }
}
