package com.ogt.buildings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BuildingExtractorApplication {

	public static void main(String[] args) {
		SpringApplication.run(BuildingExtractorApplication.class, args);
	}

}
