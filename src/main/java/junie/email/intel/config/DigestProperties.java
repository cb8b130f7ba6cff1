package junie.email.intel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "digest")
public class DigestProperties {
    /** Weekly generation, Mondays early morning by default. */
    private String cron = "0 0 6 * * MON";

    private String zone = "UTC";

    private double safeThreshold = 0.8;

    private double reviewThreshold = 0.5;

    private List<String> contentRichDomains = new ArrayList<>(List.of("medium.com", "substack.com"));

    private int sampleSubjects = 5;

    private int bulkDomainMinSenders = 2;

    private int bulkCategoryMinEmails = 5;

    /** Average AI cost per email, used for the savings estimate. */
    private double estimatedCostPerEmailCents = 0.33;

    private Duration jobLockTtl = Duration.ofMinutes(30);
}
