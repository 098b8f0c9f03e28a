package com.starscape.thumbnailer;

import com.starscape.thumbnailer.common.config.ThumbnailerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ThumbnailerProperties.class)
public class ThumbnailerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThumbnailerApplication.class, args);
    }
}
