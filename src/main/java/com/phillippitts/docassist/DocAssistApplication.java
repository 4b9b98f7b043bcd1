package com.phillippitts.docassist;

import com.phillippitts.docassist.config.properties.AdmissionProperties;
import com.phillippitts.docassist.config.properties.CapabilityProperties;
import com.phillippitts.docassist.config.properties.ClassificationProperties;
import com.phillippitts.docassist.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        AdmissionProperties.class,
        ClassificationProperties.class,
        CapabilityProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class DocAssistApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocAssistApplication.class, args);
    }

}
