package com.example.structdiff.config;

import com.example.structdiff.model.ComparisonOptions;
import com.example.structdiff.service.StructDiffService;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@ComponentScan(basePackageClasses = StructDiffService.class)
public class DiffConfig {

    @Value("${structdiff.strict:true}")
    private boolean strict;

    @Value("${structdiff.similarity:0.8}")
    private double similarity;

    @Value("${structdiff.delimiter:.}")
    private String delimiter;

    @Value("${structdiff.numeric-tolerance:0}")
    private double numericTolerance;

    @Value("${structdiff.strip:false}")
    private boolean strip;

    @Value("${structdiff.array-path:false}")
    private boolean arrayPath;

    @Value("${structdiff.use-lcs:true}")
    private boolean useLcs;

    /** Service defaults; an invalid value fails startup. */
    @Bean
    public ComparisonOptions defaultComparisonOptions() {
        ComparisonOptions options = ComparisonOptions.builder()
                .strict(strict)
                .similarity(similarity)
                .delimiter(delimiter)
                .numericTolerance(numericTolerance)
                .strip(strip)
                .arrayPath(arrayPath)
                .useLcs(useLcs)
                .build()
                .validate();
        log.info("Structural diff defaults: {}", options);
        return options;
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
