package com.phillippitts.sttguard;

import com.phillippitts.sttguard.config.properties.IntegrityProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(IntegrityProperties.class)
public class SttGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(SttGuardApplication.class, args);
    }

}
