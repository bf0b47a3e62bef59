package com.phillippitts.mediametric;

import com.phillippitts.mediametric.config.cache.ResultCacheProperties;
import com.phillippitts.mediametric.config.execution.ExecutionProperties;
import com.phillippitts.mediametric.config.properties.ThreadPoolProperties;
import com.phillippitts.mediametric.config.transcode.TranscoderConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        TranscoderConfig.class,
        ExecutionProperties.class,
        ResultCacheProperties.class,
        ThreadPoolProperties.class
})
public class MediaMetricApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaMetricApplication.class, args);
    }

}
