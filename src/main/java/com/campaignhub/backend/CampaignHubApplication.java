package com.campaignhub.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CampaignHubApplication {

	public static void main(String[] args) {
		SpringApplication.run(CampaignHubApplication.class, args);
	}
}
