package com.sandy.aiot.automation.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class AiotAutomationEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(AiotAutomationEngineApplication.class, args);
	}

}
