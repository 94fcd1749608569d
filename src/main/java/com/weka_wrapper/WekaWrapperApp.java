package com.weka_wrapper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WekaWrapperApp {

	static {
		// Disable Weka's class discovery cache to prevent ZIP file scanning issues with Spring Boot fat JARs
		System.setProperty("weka.core.ClassDiscovery.enableCache", "false");
	}

	public static void main(String[] args) {
		SpringApplication.run(WekaWrapperApp.class, args);
	}
}
