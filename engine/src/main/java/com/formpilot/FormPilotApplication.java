package com.formpilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * FormPilot - learns form answers and fills them back in.
 */
@SpringBootApplication
public class FormPilotApplication {

	public static void main(String[] args) {
		SpringApplication.run(FormPilotApplication.class, args);
	}

}
