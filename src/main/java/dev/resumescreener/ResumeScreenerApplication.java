package dev.resumescreener;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Boots the resume screening services. Callers use
 * {@link dev.resumescreener.service.ResumeIngestionService} and
 * {@link dev.resumescreener.service.ResumeScoringService} from the context.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ResumeScreenerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResumeScreenerApplication.class, args);
    }
}
