package com.civicdesk.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
@EnableScheduling
public class CivicDeskApplication {

	public static void main(String[] args) {
		// Fix default JVM timezone to UTC so audit timestamps and override expiries compare consistently
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(CivicDeskApplication.class, args);
	}

}
