package com.phillippitts.lossguard;

import com.phillippitts.lossguard.config.properties.LossSpikeProperties;
import com.phillippitts.lossguard.config.properties.RunProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        LossSpikeProperties.class,
        RunProperties.class
})
public class LossGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(LossGuardApplication.class, args);
    }

}
