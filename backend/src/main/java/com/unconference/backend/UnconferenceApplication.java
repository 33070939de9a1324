package com.unconference.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UnconferenceApplication {

	public static void main(String[] args) {
		// Timeslot boundaries are stored and compared in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(UnconferenceApplication.class, args);
	}

}
