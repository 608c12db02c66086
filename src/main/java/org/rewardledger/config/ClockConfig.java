package org.rewardledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

// Horloge fournie par l'environnement, jamais par l'appelant ; granularité d'une seconde comme l'accrual
@Configuration
public class ClockConfig {
    @Bean
    public Clock clock() {
        return Clock.tick(Clock.systemUTC(), Duration.ofSeconds(1));
    }
}
