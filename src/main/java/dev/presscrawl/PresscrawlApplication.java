package dev.presscrawl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PresscrawlApplication {

    public static void main(String[] args) {
        SpringApplication.run(PresscrawlApplication.class, args);
    }
}
