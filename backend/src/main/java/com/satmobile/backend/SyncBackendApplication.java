package com.satmobile.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SyncBackendApplication {

	public static void main(String[] args) {
		// Tenant local time is always derived explicitly, the JVM itself stays on UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(SyncBackendApplication.class, args);
	}

}
