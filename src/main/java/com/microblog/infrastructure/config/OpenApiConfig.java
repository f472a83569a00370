package com.microblog.infrastructure.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.bind.annotation.RequestMapping;

@Configuration
public class OpenApiConfig {

    private static final String API_KEY_SCHEME = "apiKey";
    private static final String ADMIN_TOKEN_SCHEME = "adminToken";
    private static final String ADMIN_PATH_PREFIX = "/api/v1/admin";

    @Bean
    public OpenAPI customOpenAPI(AppProperties appProperties) {
        return new OpenAPI()
                .info(new Info()
                        .title("Microblog API")
                        .version("1.0")
                        .description("Tweets, likes, follows, media and the ranked feed"))
                .components(new Components()
                        .addSecuritySchemes(API_KEY_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name(appProperties.getSecurity().getApiKeyHeader()))
                        .addSecuritySchemes(ADMIN_TOKEN_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-Admin-Token")));
    }

    /**
     * Attaches the matching header scheme to every operation so Swagger UI sends it.
     */
    @Bean
    public OperationCustomizer addSecurityRequirement() {
        return (operation, handlerMethod) -> {
            RequestMapping mapping = handlerMethod.getBeanType().getAnnotation(RequestMapping.class);
            String path = mapping != null ? String.join(",", mapping.value()) : "";
            String scheme = path.startsWith(ADMIN_PATH_PREFIX) ? ADMIN_TOKEN_SCHEME : API_KEY_SCHEME;
            operation.addSecurityItem(new SecurityRequirement().addList(scheme));
            return operation;
        };
    }
}
