package com.mdtable.app.config;

import com.mdtable.app.formula.FormulaEngine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FormulaProperties.class)
public class FormulaConfig {

    @Bean
    public FormulaEngine formulaEngine(FormulaProperties properties) {
        return new FormulaEngine(properties.toMathContext());
    }
}
