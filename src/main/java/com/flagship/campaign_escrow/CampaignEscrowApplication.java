package com.flagship.campaign_escrow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CampaignEscrowApplication {

    public static void main(String[] args) {
        SpringApplication.run(CampaignEscrowApplication.class, args);
    }
}
