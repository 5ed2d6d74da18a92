package com.coa;

import com.coa.pipeline.DecisionPipeline;
import com.coa.pipeline.DecisionRequest;
import com.coa.pipeline.DecisionRequestReader;
import com.coa.pipeline.DecisionResult;
import com.coa.pipeline.RankedCoa;
import com.coa.spring.EnableCoaRanking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;

/**
 * Example Spring Boot application ranking the bundled demo situation.
 * Runs only with {@code coa.demo.enabled=true}.
 */
@SpringBootApplication
@EnableCoaRanking
public class CoaApplication {

    private static final Logger log = LoggerFactory.getLogger(CoaApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CoaApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "coa.demo", name = "enabled", havingValue = "true")
    public CommandLineRunner demo(DecisionPipeline pipeline, DecisionRequestReader reader) {
        return args -> {
            log.info("=== COA Ranking Demo Started ===");

            String json = new ClassPathResource("demo-request.json")
                    .getContentAsString(StandardCharsets.UTF_8);
            DecisionRequest request = reader.read(json);
            DecisionResult result = pipeline.rank(request);

            for (RankedCoa ranked : result.rankings()) {
                log.info("#{} {} total={} excluded={} {}", ranked.rank(), ranked.coaId(),
                        String.format("%.3f", ranked.totalScore()), ranked.excluded(),
                        ranked.excludeReason() == null ? "" : ranked.excludeReason());
            }
            log.info("Applied rule: {}", result.appliedRule() == null ? "none" : result.appliedRule().ruleName());
            log.info("Result:\n{}", reader.write(result));

            log.info("=== COA Ranking Demo Completed ===");
        };
    }
}
