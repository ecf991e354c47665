package com.example.interview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class InterviewSchedulerApplication {

	public static void main(String[] args) {
		SpringApplication.run(InterviewSchedulerApplication.class, args);
	}

}
