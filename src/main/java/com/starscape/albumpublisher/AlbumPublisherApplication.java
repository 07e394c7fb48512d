package com.starscape.albumpublisher;

import com.starscape.albumpublisher.common.config.ProcessingProperties;
import com.starscape.albumpublisher.common.config.PublishingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ProcessingProperties.class, PublishingProperties.class})
public class AlbumPublisherApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(AlbumPublisherApplication.class, args)));
    }
}
