package org.mimir;

import org.mimir.config.MimirProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(MimirProperties.class)
public class MimirApplication {

	public static void main(String[] args) {
		SpringApplication.run(MimirApplication.class, args);
	}
}
