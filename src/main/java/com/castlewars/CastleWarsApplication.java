package com.castlewars;

import com.castlewars.config.GameProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(GameProperties.class)
public class CastleWarsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CastleWarsApplication.class, args);
    }
}
