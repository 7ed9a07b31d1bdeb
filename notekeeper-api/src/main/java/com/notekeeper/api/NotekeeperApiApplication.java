package com.notekeeper.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.notekeeper")
@EnableJpaRepositories(basePackages = "com.notekeeper")
@EntityScan(basePackages = "com.notekeeper")
@ConfigurationPropertiesScan(basePackages = "com.notekeeper")
public class NotekeeperApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(NotekeeperApiApplication.class, args);
  }
}
