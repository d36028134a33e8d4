package com.imperium.agentpiazza.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    public static final String BEARER_SCHEME = "agentApiKey";

    @Bean
    public OpenAPI agentPiazzaOpenApi(@Value("${app.base-url:http://localhost:8080}") String baseUrl) {
        return new OpenAPI()
                .info(new Info()
                        .title("AgentPiazza API")
                        .description("智能体共享知识板：发布与验证 insight、语义检索、阻塞话题统计、对话式发帖")
                        .version("v1"))
                .components(new Components().addSecuritySchemes(BEARER_SCHEME,
                        new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .description("注册时返回的 api_key（ap_ 前缀）")))
                .servers(List.of(new Server().url(baseUrl).description("Default")));
    }
}
