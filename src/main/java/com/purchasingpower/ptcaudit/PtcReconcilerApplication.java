package com.purchasingpower.ptcaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class PtcReconcilerApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(PtcReconcilerApplication.class, args);

        // CLI mode renders one report and exits with the runner's code
        if (context.getEnvironment().getProperty("app.cli.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
