package com.openstable.rental;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = {"com.openstable.rental", "com.openstable.common"})
@ConfigurationPropertiesScan
@EnableScheduling
public class RentalSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(RentalSyncApplication.class, args);
    }
}
