package org.nowstart.traderbot.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class SwaggerConfig {

    private final ObjectProvider<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        BuildProperties build = buildProperties.getIfAvailable();
        return new OpenAPI()
                .info(new Info()
                        .title("traderbot API")
                        .description("Strategy sessions, backtests and order sink passthrough of the traderbot engine.")
                        .version(build == null ? "dev" : build.getVersion()));
    }
}
