package com.companionagent.orchestrator.completion;

import com.companionagent.common.exception.PipelineException;
import com.companionagent.common.exception.PipelineException.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of every {@link CompletionProvider} bean, keyed by {@link CompletionProvider#name()},
 * plus the task-level entry point the pipeline nodes use.
 */
@Component
public class CompletionProviders {

    private static final Logger log = LoggerFactory.getLogger(CompletionProviders.class);

    private final Map<String, CompletionProvider> providers = new LinkedHashMap<>();
    private final ModelSelector modelSelector;

    public CompletionProviders(List<CompletionProvider> providers, ModelSelector modelSelector) {
        providers.forEach(p -> this.providers.put(p.name(), p));
        this.modelSelector = modelSelector;
        log.info("[Completion] Providers registered. providers={} configured={}",
            this.providers.keySet(),
            providers.stream().filter(CompletionProvider::isConfigured).map(CompletionProvider::name).toList());
    }

    public CompletionProvider resolve(String name) {
        CompletionProvider provider = providers.get(name);
        if (provider == null) {
            throw new PipelineException("Completion", FailureKind.PROVIDER_FAILURE, "Unknown provider: " + name);
        }
        return provider;
    }

    /** One completion for {@code task} with the model configured for it. */
    public Mono<CompletionResult> complete(CompletionTask task, String system, String user,
                                           double temperature, int maxTokens) {
        return Mono.defer(() -> {
            ModelSelector.ModelChoice choice = modelSelector.select(task);
            return resolve(choice.provider())
                .complete(CompletionRequest.of(choice.model(), system, user, temperature, maxTokens));
        });
    }
}
