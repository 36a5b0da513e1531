package com.phillippitts.modelorchestrator.config;

import com.phillippitts.modelorchestrator.config.properties.ConcurrencyProperties;
import com.phillippitts.modelorchestrator.config.properties.MockModelProperties;
import com.phillippitts.modelorchestrator.config.properties.ModelApiProperties;
import com.phillippitts.modelorchestrator.config.properties.OrchestrationProperties;
import com.phillippitts.modelorchestrator.service.invoker.AnthropicModelInvoker;
import com.phillippitts.modelorchestrator.service.invoker.ConcurrencyGuard;
import com.phillippitts.modelorchestrator.service.invoker.ConcurrencyLimitedInvoker;
import com.phillippitts.modelorchestrator.service.invoker.GeminiModelInvoker;
import com.phillippitts.modelorchestrator.service.invoker.MockModelInvoker;
import com.phillippitts.modelorchestrator.service.invoker.ModelBackend;
import com.phillippitts.modelorchestrator.service.invoker.ModelInvoker;
import com.phillippitts.modelorchestrator.service.invoker.ModelInvokerRegistry;
import com.phillippitts.modelorchestrator.service.invoker.OpenAiChatModelInvoker;
import com.phillippitts.modelorchestrator.service.invoker.OpenAiCompletionModelInvoker;
import com.phillippitts.modelorchestrator.service.invoker.TimeoutGuardedInvoker;
import com.phillippitts.modelorchestrator.util.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Semaphore;

/**
 * Builds the model registry once at startup: one invoker per {@link ModelBackend}, each wrapped
 * as {@code TimeoutGuarded(ConcurrencyLimited(backend))}.
 *
 * <p>With {@code orchestrator.mock-models=true} every backend is replaced by a
 * {@link MockModelInvoker}.
 */
@Configuration
public class ModelInvokerConfig {

    private static final Logger LOG = LogManager.getLogger(ModelInvokerConfig.class);

    @Bean
    public ModelInvokerRegistry modelInvokerRegistry(OrchestrationProperties orchestrationProperties,
                                                     ModelApiProperties apiProperties,
                                                     MockModelProperties mockProperties,
                                                     ConcurrencyProperties concurrencyProperties,
                                                     RestClient.Builder restClientBuilder,
                                                     @Qualifier("invokerExecutor") AsyncTaskExecutor invokerExecutor,
                                                     ApplicationEventPublisher publisher) {
        RestClient.Builder builder = restClientBuilder.requestFactory(
                requestFactory(orchestrationProperties.getMaxTimeoutMs()));
        Random random = mockProperties.seed() == 0 ? new Random() : new Random(mockProperties.seed());

        List<ModelInvoker> invokers = new ArrayList<>();
        for (ModelBackend backend : ModelBackend.values()) {
            ModelInvoker raw = orchestrationProperties.isMockModels()
                    ? new MockModelInvoker(backend.id(), mockProperties, random, Sleeper.THREAD_SLEEP)
                    : httpInvoker(backend, apiProperties, builder);
            ConcurrencyGuard guard = new ConcurrencyGuard(
                    new Semaphore(concurrencyProperties.getMaxInFlightPerModel()),
                    concurrencyProperties.getAcquireTimeoutMs(),
                    backend.id(),
                    publisher);
            invokers.add(new TimeoutGuardedInvoker(new ConcurrencyLimitedInvoker(raw, guard), invokerExecutor));
        }

        ModelInvokerRegistry registry = new ModelInvokerRegistry(invokers);
        LOG.info("Model registry ready ({} mode): {}",
                orchestrationProperties.isMockModels() ? "mock" : "live", registry.readiness());
        return registry;
    }

    static ModelInvoker httpInvoker(ModelBackend backend, ModelApiProperties api, RestClient.Builder builder) {
        return switch (backend) {
            case GEMINI -> new GeminiModelInvoker(api, builder);
            case GPT4 -> new OpenAiChatModelInvoker(api, builder);
            case CODEX -> new OpenAiCompletionModelInvoker(api, builder);
            case CLAUDE -> new AnthropicModelInvoker(api, builder);
        };
    }

    /**
     * JDK client: blocking sends are interruptible, so a cancelled attempt releases its thread.
     * The read timeout is a backstop at the maximum per-attempt timeout.
     */
    private static JdkClientHttpRequestFactory requestFactory(long maxTimeoutMs) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(Duration.ofMillis(maxTimeoutMs));
        return factory;
    }
}
