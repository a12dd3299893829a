package com.phillippitts.sessionscribe;

import com.phillippitts.sessionscribe.config.properties.HydrationProperties;
import com.phillippitts.sessionscribe.config.properties.MonitoringProperties;
import com.phillippitts.sessionscribe.config.properties.RecordingProperties;
import com.phillippitts.sessionscribe.config.properties.ResamplerProperties;
import com.phillippitts.sessionscribe.config.properties.SttProperties;
import com.phillippitts.sessionscribe.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        RecordingProperties.class,
        ResamplerProperties.class,
        SttProperties.class,
        HydrationProperties.class,
        MonitoringProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class SessionScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionScribeApplication.class, args);
    }

}
