package com.phillippitts.modelelector;

import com.phillippitts.modelelector.config.properties.ElectorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(ElectorProperties.class)
@EnableScheduling
public class ModelElectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelElectorApplication.class, args);
    }

}
