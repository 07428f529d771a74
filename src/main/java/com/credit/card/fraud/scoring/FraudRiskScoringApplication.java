package com.credit.card.fraud.scoring;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class FraudRiskScoringApplication {

	public static void main(String[] args) {
		SpringApplication.run(FraudRiskScoringApplication.class, args);
	}

}
