package com.companionagent.orchestrator.completion;

import com.companionagent.common.model.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Maps each {@link CompletionTask} to the provider and model that serve it.
 *
 * <p>The draft tier follows the route: {@code nano} uses the small model, {@code pro} and
 * {@code pro+tools} the full one. Classifier and judge default to a fast, cheap endpoint.
 */
@Component
public class ModelSelector {

    private static final Logger log = LoggerFactory.getLogger(ModelSelector.class);

    /** Provider + model pair for one call. */
    public record ModelChoice(String provider, String model) {}

    @Value("${models.classifier.provider:groq}")
    private String classifierProvider;
    @Value("${models.classifier.model:llama-3.1-8b-instant}")
    private String classifierModel;

    @Value("${models.planner.provider:anthropic}")
    private String plannerProvider;
    @Value("${models.planner.model:claude-haiku-4-5-20251001}")
    private String plannerModel;

    @Value("${models.draft-nano.provider:anthropic}")
    private String draftNanoProvider;
    @Value("${models.draft-nano.model:claude-haiku-4-5-20251001}")
    private String draftNanoModel;

    @Value("${models.draft-pro.provider:anthropic}")
    private String draftProProvider;
    @Value("${models.draft-pro.model:claude-sonnet-4-6}")
    private String draftProModel;

    @Value("${models.repair.provider:anthropic}")
    private String repairProvider;
    @Value("${models.repair.model:claude-sonnet-4-6}")
    private String repairModel;

    @Value("${models.judge.provider:groq}")
    private String judgeProvider;
    @Value("${models.judge.model:llama-3.1-8b-instant}")
    private String judgeModel;

    public ModelChoice select(CompletionTask task) {
        ModelChoice choice = switch (task) {
            case CLASSIFIER -> new ModelChoice(classifierProvider, classifierModel);
            case PLANNER    -> new ModelChoice(plannerProvider, plannerModel);
            case DRAFT_NANO -> new ModelChoice(draftNanoProvider, draftNanoModel);
            case DRAFT_PRO  -> new ModelChoice(draftProProvider, draftProModel);
            case REPAIR     -> new ModelChoice(repairProvider, repairModel);
            case JUDGE      -> new ModelChoice(judgeProvider, judgeModel);
        };
        log.debug("MODEL_SELECTED task={} provider={} model={}", task, choice.provider(), choice.model());
        return choice;
    }

    /** Draft task for the routed tier. */
    public static CompletionTask draftTask(Route route) {
        return route == Route.NANO ? CompletionTask.DRAFT_NANO : CompletionTask.DRAFT_PRO;
    }
}
