package com.phillippitts.n8nsync;

import com.phillippitts.n8nsync.config.properties.N8nApiProperties;
import com.phillippitts.n8nsync.config.properties.SyncProperties;
import com.phillippitts.n8nsync.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        N8nApiProperties.class,
        SyncProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class N8nSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(N8nSyncApplication.class, args);
    }

}
