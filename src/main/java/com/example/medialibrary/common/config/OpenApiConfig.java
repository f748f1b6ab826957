package com.example.medialibrary.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI mediaLibraryOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Media Library API")
                        .description("Library sync, playback queue, playlists, facets and channel catalog")
                        .version("v1"));
    }

    @Bean
    public GroupedOpenApi libraryApi() {
        return GroupedOpenApi.builder()
                .group("library")
                .pathsToMatch("/api/v1/library/**", "/api/v1/tracks/**", "/api/v1/facets/**", "/api/v1/media/**")
                .build();
    }

    @Bean
    public GroupedOpenApi collectionsApi() {
        return GroupedOpenApi.builder()
                .group("collections")
                .pathsToMatch("/api/v1/queue/**", "/api/v1/playlists/**")
                .build();
    }

    @Bean
    public GroupedOpenApi channelsApi() {
        return GroupedOpenApi.builder()
                .group("channels")
                .pathsToMatch("/api/v1/channels/**")
                .build();
    }
}
