package com.dining.reservation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DiningReservationApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiningReservationApplication.class, args);
    }
}
