package io.github.drompincen.folioagent.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.folioagent")
@EnableMongoRepositories(basePackages = "io.github.drompincen.folioagent.persistence.repository")
public class FolioAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(FolioAgentApplication.class, args);
    }
}
