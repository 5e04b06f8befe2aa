package uk.gegc.reviewhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ReviewHubBillingApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReviewHubBillingApplication.class, args);
    }
}
