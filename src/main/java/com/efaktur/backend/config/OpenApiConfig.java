package com.efaktur.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI efakturOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("E-Faktur Validation Service")
                        .description("Extracts e-Faktur fields from PDF/JPG/PNG uploads, looks up the DJP record "
                                + "referenced by the embedded QR code and reports every deviation.")
                        .version("v1")
                        .license(new License().name("Proprietary"))
                );
    }
}
