package com.bank.fraud.config;

import com.bank.fraud.engine.RuleCatalog;
import com.bank.fraud.engine.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring for the evaluation pipeline: the composed rule catalog, the signal executor
 * and the clock used to stamp assessments.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    /**
     * Composes the rule sets named in {@code monitoring.rule-sets}, in that order.
     */
    @Bean
    public RuleCatalog ruleCatalog(List<RuleSet> ruleSets, MonitoringConfig config) {
        Map<String, RuleSet> byPrefix = new LinkedHashMap<>();
        for (RuleSet set : ruleSets) {
            if (byPrefix.put(set.prefix(), set) != null) {
                throw new IllegalStateException("Two rule sets use prefix " + set.prefix());
            }
        }

        List<RuleSet> selected = new ArrayList<>();
        for (String name : config.getRuleSets()) {
            RuleSet set = byPrefix.get(name);
            if (set == null) {
                throw new IllegalStateException("Unknown rule set '" + name + "', available: " + byPrefix.keySet());
            }
            selected.add(set);
        }

        RuleCatalog catalog = RuleCatalog.compose(selected, config.getRuleWeights(), config.getDisabledRules());
        log.info("Composed rule catalog from {} with {} rules", config.getRuleSets(), catalog.size());
        return catalog;
    }

    @Bean(name = "signalExecutor", destroyMethod = "shutdownNow")
    public ExecutorService signalExecutor(MonitoringConfig config) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "signal-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(config.getAssembly().getThreads(), factory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
