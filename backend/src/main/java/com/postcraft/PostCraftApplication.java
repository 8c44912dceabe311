package com.postcraft;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * PostCraft - brand social post generation service.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class PostCraftApplication {

	public static void main(String[] args) {
		SpringApplication.run(PostCraftApplication.class, args);
	}

}
