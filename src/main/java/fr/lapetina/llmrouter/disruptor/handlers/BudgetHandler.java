package fr.lapetina.llmrouter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llmrouter.domain.event.CompletionRequestEvent;
import fr.lapetina.llmrouter.domain.event.EventState;
import fr.lapetina.llmrouter.domain.model.CompletionRequest;
import fr.lapetina.llmrouter.domain.model.LoadBalancerException;
import fr.lapetina.llmrouter.domain.routing.RoutingEngine;
import fr.lapetina.llmrouter.infrastructure.budget.CostBudgetTracker;
import fr.lapetina.llmrouter.infrastructure.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fourth stage handler: reserves the request's estimated cost against the hourly budget.
 *
 * The estimate assumes the cheapest registered provider, so a request is only refused when no
 * provider could serve it within budget. A refused request gives its admission slot back.
 */
public final class BudgetHandler implements EventHandler<CompletionRequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(BudgetHandler.class);

    private final CostBudgetTracker budgetTracker;
    private final ProviderRegistry providerRegistry;
    private final AdmissionHandler admissionHandler;

    public BudgetHandler(
            CostBudgetTracker budgetTracker,
            ProviderRegistry providerRegistry,
            AdmissionHandler admissionHandler
    ) {
        this.budgetTracker = budgetTracker;
        this.providerRegistry = providerRegistry;
        this.admissionHandler = admissionHandler;
    }

    @Override
    public void onEvent(CompletionRequestEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.ADMITTED) {
            return;
        }

        CompletionRequest request = event.getRequest();
        double estimate = RoutingEngine.estimateCost(request, providerRegistry.lowestCostPerToken());

        try {
            CostBudgetTracker.Reservation reservation = budgetTracker.tryReserve(estimate);
            event.markBudgetReserved(reservation);
            log.debug("Budget reserved: requestId={}, estimateUsd={}", request.requestId(), estimate);
        } catch (LoadBalancerException e) {
            event.reject(EventState.BUDGET_REJECTED, e);
            admissionHandler.releaseSlot();
        }
    }
}
