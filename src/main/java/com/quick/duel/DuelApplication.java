package com.quick.duel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DuelApplication {

	public static void main(String[] args) {
		SpringApplication.run(DuelApplication.class, args);
	}

}
