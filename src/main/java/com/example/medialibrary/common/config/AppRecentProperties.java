package com.example.medialibrary.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.recent")
public class AppRecentProperties {

    private int defaultLimit = 100;
}
