package fr.lapetina.llmrouter.infrastructure.budget;

import fr.lapetina.llmrouter.domain.model.LoadBalancerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Hourly spend ceiling, enforced check-then-reserve.
 *
 * Spend accumulates per fixed wall-clock hour (UTC) and resets when the hour turns. Before
 * dispatch a request reserves its estimated cost; the reservation is refused if it would take
 * the window above the ceiling. After the call the reservation is settled with the actual cost,
 * which is charged in full even when it overshoots, so the next request is the one refused.
 *
 * Lock-free: the window is an immutable value swapped with compare-and-set.
 */
public final class CostBudgetTracker {

    private static final Logger log = LoggerFactory.getLogger(CostBudgetTracker.class);

    /**
     * Spend inside one hourly window.
     */
    record Window(Instant start, double spentUsd) {
    }

    /**
     * Amount held for one in-flight request.
     */
    public record Reservation(Instant windowStart, double amountUsd) {
    }

    private final double hourlyLimitUsd;
    private final Clock clock;
    private final AtomicReference<Window> window;
    private final DoubleAdder lifetimeSpend = new DoubleAdder();

    /**
     * @param hourlyLimitUsd ceiling per hour; null, zero or negative means unlimited
     */
    public CostBudgetTracker(Double hourlyLimitUsd, Clock clock) {
        this.hourlyLimitUsd = hourlyLimitUsd != null && hourlyLimitUsd > 0 ? hourlyLimitUsd : Double.NaN;
        this.clock = Objects.requireNonNull(clock);
        this.window = new AtomicReference<>(new Window(currentHour(), 0.0));
        if (isLimited()) {
            log.info("CostBudgetTracker initialized: hourlyLimitUsd={}", hourlyLimitUsd);
        } else {
            log.info("CostBudgetTracker initialized without hourly limit");
        }
    }

    /**
     * Reserves the estimated cost of a request in the current window.
     *
     * @throws LoadBalancerException with COST_BUDGET_EXCEEDED if spend + estimate would exceed the ceiling
     */
    public Reservation tryReserve(double estimatedCostUsd) {
        double amount = Math.max(0.0, estimatedCostUsd);
        while (true) {
            Window current = currentWindow();
            double next = current.spentUsd() + amount;
            if (isLimited() && next > hourlyLimitUsd) {
                log.warn("Budget reservation refused: spentUsd={}, estimateUsd={}, hourlyLimitUsd={}",
                        current.spentUsd(), amount, hourlyLimitUsd);
                throw LoadBalancerException.costBudgetExceeded(current.spentUsd(), amount, hourlyLimitUsd);
            }
            if (window.compareAndSet(current, new Window(current.start(), next))) {
                return new Reservation(current.start(), amount);
            }
        }
    }

    /**
     * Replaces a reservation with the actual cost of the completed call.
     */
    public void settle(Reservation reservation, double actualCostUsd) {
        double actual = Math.max(0.0, actualCostUsd);
        lifetimeSpend.add(actual);
        adjust(reservation, actual - reservation.amountUsd(), actual);
    }

    /**
     * Returns a reservation whose call did not complete; nothing is charged.
     */
    public void release(Reservation reservation) {
        adjust(reservation, -reservation.amountUsd(), 0.0);
    }

    /**
     * @param delta      change to apply if the reservation belongs to the current window
     * @param freshSpend amount to charge if the window rolled over since reserving
     */
    private void adjust(Reservation reservation, double delta, double freshSpend) {
        while (true) {
            Window current = currentWindow();
            double change = current.start().equals(reservation.windowStart()) ? delta : freshSpend;
            if (change == 0.0) {
                return;
            }
            Window updated = new Window(current.start(), Math.max(0.0, current.spentUsd() + change));
            if (window.compareAndSet(current, updated)) {
                return;
            }
        }
    }

    private Window currentWindow() {
        while (true) {
            Window current = window.get();
            Instant hour = currentHour();
            if (!hour.isAfter(current.start())) {
                return current;
            }
            Window fresh = new Window(hour, 0.0);
            if (window.compareAndSet(current, fresh)) {
                log.info("Budget window reset: previousSpendUsd={}, windowStart={}", current.spentUsd(), hour);
                return fresh;
            }
        }
    }

    private Instant currentHour() {
        return clock.instant().truncatedTo(ChronoUnit.HOURS);
    }

    public boolean isLimited() {
        return !Double.isNaN(hourlyLimitUsd);
    }

    /**
     * Configured ceiling, or NaN when unlimited.
     */
    public double getHourlyLimitUsd() {
        return hourlyLimitUsd;
    }

    public double getSpentThisWindowUsd() {
        return currentWindow().spentUsd();
    }

    public double getRemainingUsd() {
        return isLimited() ? Math.max(0.0, hourlyLimitUsd - getSpentThisWindowUsd()) : Double.POSITIVE_INFINITY;
    }

    public double getLifetimeSpendUsd() {
        return lifetimeSpend.sum();
    }
}
