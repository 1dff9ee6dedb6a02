package com.nofx.execution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExecutionEngineApplication {
	public static void main(String[] args) {
		SpringApplication.run(ExecutionEngineApplication.class, args);
	}
}
