package com.phillippitts.sttpool;

import com.phillippitts.sttpool.config.properties.WorkerPoolProperties;
import com.phillippitts.sttpool.config.stt.VoskConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        VoskConfig.class,
        WorkerPoolProperties.class
})
@EnableScheduling
public class SttPoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(SttPoolApplication.class, args);
    }

}
