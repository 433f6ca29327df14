package com.mk.fx.qa.boundary.analysis.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI boundaryAnalysisOpenApi() {
    return new OpenAPI()
        .info(
            new Info()
                .title("Protocol Boundary Analysis API")
                .version("v1")
                .description(
                    "Compares HTTP/2 and HTTP/3 benchmark samples per network condition and"
                        + " classifies each condition as stable_superior, performance_crossover,"
                        + " close_performance or not_significant."));
  }
}
