package com.ai.screening.config;

import com.ai.screening.service.RegionalValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Configuration
public class ScreeningConfig {

    private static final Logger log = LoggerFactory.getLogger(ScreeningConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Region sets are read once at startup and never change for the life of the process.
     */
    @Bean
    public RegionalValidator regionalValidator(
            @Value("${screening.regions.eligible:RS,SC,PR,SP,RJ,MG,ES,GO,MT,MS,DF}") String eligible,
            @Value("${screening.regions.interest:BA,PE,CE,RN,PB,AL,SE,PI,MA,AP,AM,RR,AC,TO}") String interest) {
        RegionalValidator validator = new RegionalValidator(split(eligible), split(interest));
        log.info("Regions loaded: eligible={} interest={}",
                validator.getEligibleRegions(), validator.getInterestRegions());
        return validator;
    }

    private static List<String> split(String csv) {
        if (csv == null) return List.of();
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
