package com.dining.reservation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI diningReservationsOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Dining Reservations API")
                .description("Finds restaurants that can seat a group of eaters at a given time, "
                    + "honouring dietary restrictions, and books tables without double-booking "
                    + "tables or people.")
                .version("1.0.0"));
    }
}
