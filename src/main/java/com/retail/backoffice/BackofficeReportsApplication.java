package com.retail.backoffice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BackofficeReportsApplication {

	public static void main(String[] args) {
		SpringApplication.run(BackofficeReportsApplication.class, args);
	}

}
