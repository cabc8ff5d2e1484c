package com.showdownlab.optimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Showdown lineup optimizer service: synchronous lineup generation plus
 * queued backtest and model discovery jobs run by internal workers.
 */
@SpringBootApplication
public class ShowdownOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShowdownOptimizerApplication.class, args);
    }

}
