package com.starscape.photocatalog;

import com.starscape.photocatalog.common.config.DeviceProperties;
import com.starscape.photocatalog.common.config.ImagingProperties;
import com.starscape.photocatalog.common.config.IngestProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({IngestProperties.class, ImagingProperties.class, DeviceProperties.class})
public class PhotoCatalogApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PhotoCatalogApplication.class, args)));
    }
}
