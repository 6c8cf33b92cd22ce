package com.example.shorts_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ShortsBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(ShortsBackendApplication.class, args);
	}

}
