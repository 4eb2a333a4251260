package rasterlab.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Raster API")
            .version("v1")
            .description("Rasterizes lines, circles and cubic Bézier curves into pixel samples "
                + "with classic algorithms (stepwise, DDA, Bresenham, de Casteljau, Wu)")
            .contact(new Contact().name("Raster Lab").email("raster-api@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")))
        .externalDocs(new ExternalDocumentation()
            .description("Algorithm notes")
            .url("https://docs.raster-api.dev"));
  }
}
