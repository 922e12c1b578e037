package com.example.accounts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableJpaRepositories(basePackages = "com.example.accounts.repository")
public class TelegramAccountManagerApplication {

	public static void main(String[] args) {
		SpringApplication.run(TelegramAccountManagerApplication.class, args);
	}

}
