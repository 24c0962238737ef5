package com.erpdashboard.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ErpBackendApplication {

	public static void main(String[] args) {
		// persisted timestamps and logs are UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(ErpBackendApplication.class, args);
	}

}
