package com.showdownlab.optimizer.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Repository scanning and auditing for job, game and model tables.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.showdownlab.optimizer.repository")
@EnableJpaAuditing
@EnableTransactionManagement
public class JpaConfig {
}
