package org.tcgstats.metalens_api.core.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    OpenAPI apiInfo() {
        return new OpenAPI()
                .info(new Info()
                        .title("MetaLens API")
                        .description("Metagame share, win rates and matchup matrices computed from tournament results.")
                        .version("v1")
                        .license(new License().name("Apache 2.0")));
    }
}
