package com.phillippitts.aura;

import com.phillippitts.aura.config.properties.ClientProperties;
import com.phillippitts.aura.config.properties.LexiconProperties;
import com.phillippitts.aura.config.properties.PatientStoreProperties;
import com.phillippitts.aura.config.properties.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        PipelineProperties.class,
        LexiconProperties.class,
        ClientProperties.class,
        PatientStoreProperties.class
})
public class AuraApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuraApplication.class, args);
    }

}
