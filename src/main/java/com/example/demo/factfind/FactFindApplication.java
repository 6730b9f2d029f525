package com.example.demo.factfind;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FactFindApplication {

	public static void main(String[] args) {
		SpringApplication.run(FactFindApplication.class, args);
	}

}
