package com.starscape.borderframe;

import com.starscape.borderframe.common.config.ProcessingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ProcessingProperties.class)
public class BorderFrameApplication {

    public static void main(String[] args) {
        SpringApplication.run(BorderFrameApplication.class, args);
    }
}
