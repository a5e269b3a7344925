package com.phillippitts.apiguard;

import com.phillippitts.apiguard.config.properties.BudgetProperties;
import com.phillippitts.apiguard.config.properties.CircuitBreakerProperties;
import com.phillippitts.apiguard.config.properties.RateLimitProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        CircuitBreakerProperties.class,
        RateLimitProperties.class,
        BudgetProperties.class
})
public class ApiGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiGuardApplication.class, args);
    }

}
