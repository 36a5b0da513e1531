package com.phillippitts.modelorchestrator;

import com.phillippitts.modelorchestrator.config.properties.ConcurrencyProperties;
import com.phillippitts.modelorchestrator.config.properties.MockModelProperties;
import com.phillippitts.modelorchestrator.config.properties.ModelApiProperties;
import com.phillippitts.modelorchestrator.config.properties.OrchestrationProperties;
import com.phillippitts.modelorchestrator.config.properties.RetryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        OrchestrationProperties.class,
        RetryProperties.class,
        ConcurrencyProperties.class,
        MockModelProperties.class,
        ModelApiProperties.class
})
@EnableScheduling
public class ModelOrchestratorApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(ModelOrchestratorApplication.class, args);
        if (context.getEnvironment().getProperty("orchestrator.cli.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
