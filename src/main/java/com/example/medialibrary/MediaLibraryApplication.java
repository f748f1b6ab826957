package com.example.medialibrary;

import com.example.medialibrary.common.config.AppLibraryProperties;
import com.example.medialibrary.common.config.AppRecentProperties;
import com.example.medialibrary.common.config.AppScanProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@MapperScan("com.example.medialibrary.infrastructure.persistence.mapper")
@EnableConfigurationProperties({
        AppLibraryProperties.class,
        AppScanProperties.class,
        AppRecentProperties.class
})
public class MediaLibraryApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaLibraryApplication.class, args);
    }
}
