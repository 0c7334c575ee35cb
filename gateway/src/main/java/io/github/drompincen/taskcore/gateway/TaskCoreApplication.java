package io.github.drompincen.taskcore.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.taskcore")
@EnableMongoRepositories(basePackages = "io.github.drompincen.taskcore.persistence.repository")
@ConfigurationPropertiesScan(basePackageClasses = TaskCoreApplication.class)
@EnableScheduling
public class TaskCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskCoreApplication.class, args);
    }
}
