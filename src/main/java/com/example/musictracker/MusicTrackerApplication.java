package com.example.musictracker;

import com.example.musictracker.common.config.AppTrackerProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@MapperScan("com.example.musictracker.infrastructure.persistence.mapper")
@EnableConfigurationProperties(AppTrackerProperties.class)
public class MusicTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MusicTrackerApplication.class, args);
    }
}
