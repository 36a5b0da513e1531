package com.phillippitts.modelorchestrator.config;

import com.phillippitts.modelorchestrator.config.properties.OrchestrationProperties;
import com.phillippitts.modelorchestrator.config.properties.RetryProperties;
import com.phillippitts.modelorchestrator.service.invoker.ModelInvokerRegistry;
import com.phillippitts.modelorchestrator.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.modelorchestrator.service.orchestration.FanOutCoordinator;
import com.phillippitts.modelorchestrator.service.orchestration.OrchestrationRequestValidator;
import com.phillippitts.modelorchestrator.service.orchestration.OrchestrationService;
import com.phillippitts.modelorchestrator.service.retry.BackoffPolicy;
import com.phillippitts.modelorchestrator.service.retry.RetryController;
import com.phillippitts.modelorchestrator.util.Sleeper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the orchestration core explicitly; the core classes carry no Spring annotations.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public BackoffPolicy backoffPolicy(RetryProperties retryProperties) {
        return BackoffPolicy.from(retryProperties);
    }

    @Bean
    public RetryController retryController(ModelInvokerRegistry registry,
                                           BackoffPolicy backoffPolicy,
                                           OrchestrationMetricsPublisher metricsPublisher) {
        return new RetryController(registry, backoffPolicy, Sleeper.THREAD_SLEEP, metricsPublisher);
    }

    @Bean
    public FanOutCoordinator fanOutCoordinator(RetryController retryController,
                                               @Qualifier("modelExecutor") Executor modelExecutor) {
        return new FanOutCoordinator(retryController, modelExecutor);
    }

    @Bean
    public OrchestrationRequestValidator orchestrationRequestValidator(OrchestrationProperties properties,
                                                                       ModelInvokerRegistry registry) {
        return new OrchestrationRequestValidator(properties, registry);
    }

    @Bean
    public OrchestrationService orchestrationService(OrchestrationRequestValidator validator,
                                                     FanOutCoordinator coordinator,
                                                     ApplicationEventPublisher publisher,
                                                     OrchestrationMetricsPublisher metricsPublisher) {
        return new OrchestrationService(validator, coordinator, publisher, metricsPublisher);
    }
}
