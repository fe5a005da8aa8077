package com.yoojuno.switcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StreamSwitcherApplication {
    public static void main(String[] args) {
        SpringApplication.run(StreamSwitcherApplication.class, args);
    }
}
