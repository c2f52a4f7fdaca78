package com.community.movierating;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // cache sweep and guard expiry run on the Spring scheduler
@ConfigurationPropertiesScan
public class MovieRatingBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(MovieRatingBackendApplication.class, args);
    }

}
