package com.rollcall.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RollcallApplication {

	public static void main(String[] args) {
		// Attendance days are UTC calendar days; keep the JVM on the same zone
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(RollcallApplication.class, args);
	}

}
