package com.loadspec;

import com.loadspec.config.ParserProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ParserProperties.class)
public class LoadSpecAgentApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(LoadSpecAgentApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

}
