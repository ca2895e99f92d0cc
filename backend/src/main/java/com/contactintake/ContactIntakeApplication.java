package com.contactintake;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ContactIntake - bulk contact line parsing for pasted text.
 */
@SpringBootApplication
public class ContactIntakeApplication {

	public static void main(String[] args) {
		SpringApplication.run(ContactIntakeApplication.class, args);
	}

}
