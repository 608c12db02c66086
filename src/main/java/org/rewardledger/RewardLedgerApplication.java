package org.rewardledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling  // heartbeat du flux SSE des événements
public class RewardLedgerApplication {
    public static void main(String[] args) {
        SpringApplication.run(RewardLedgerApplication.class, args);
    }
}
