package com.familyportfolio.domain.service;

import com.familyportfolio.domain.model.CashFlow;
import com.familyportfolio.domain.model.ValuationSnapshot;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Period returns over an externally supplied valuation baseline. Both methods return empty when
 * the return is not defined for the inputs.
 */
public class ReturnCalculator {

    /**
     * Modified Dietz return. Each flow is weighted by the fraction of the period it was invested;
     * flows dated outside the period are ignored. Empty when the period has no length or the
     * weighted capital is not positive.
     */
    public Optional<BigDecimal> calculateModifiedDietz(BigDecimal startValue,
                                                       BigDecimal endValue,
                                                       LocalDate periodStart,
                                                       LocalDate periodEnd,
                                                       List<CashFlow> cashFlows) {
        Objects.requireNonNull(startValue, "startValue must not be null");
        Objects.requireNonNull(endValue, "endValue must not be null");
        Objects.requireNonNull(periodStart, "periodStart must not be null");
        Objects.requireNonNull(periodEnd, "periodEnd must not be null");
        Objects.requireNonNull(cashFlows, "cashFlows must not be null");

        long totalDays = ChronoUnit.DAYS.between(periodStart, periodEnd);
        if (totalDays <= 0) {
            return Optional.empty();
        }

        BigDecimal days = BigDecimal.valueOf(totalDays);
        BigDecimal netFlows = BigDecimal.ZERO;
        BigDecimal weightedFlows = BigDecimal.ZERO;

        for (CashFlow flow : cashFlows) {
            if (flow.date().isBefore(periodStart) || flow.date().isAfter(periodEnd)) {
                continue;
            }
            long daysSinceStart = ChronoUnit.DAYS.between(periodStart, flow.date());
            BigDecimal weight = DecimalMath.divide(BigDecimal.valueOf(totalDays - daysSinceStart), days);

            netFlows = netFlows.add(flow.amount());
            weightedFlows = weightedFlows.add(flow.amount().multiply(weight));
        }

        BigDecimal denominator = startValue.add(weightedFlows);
        if (denominator.signum() <= 0) {
            return Optional.empty();
        }

        BigDecimal gain = endValue.subtract(startValue).subtract(netFlows);
        return Optional.of(DecimalMath.divide(gain, denominator));
    }

    /**
     * Time-weighted return chaining the sub-periods delimited by the snapshots. A sub-period
     * that starts from a non-positive value has no defined return and is left out of the chain,
     * so a portfolio funded from zero is measured from its first contribution onwards.
     * Empty when no sub-period could be measured.
     */
    public Optional<BigDecimal> calculateTimeWeightedReturn(BigDecimal startValue,
                                                            BigDecimal endValue,
                                                            List<ValuationSnapshot> snapshots) {
        Objects.requireNonNull(startValue, "startValue must not be null");
        Objects.requireNonNull(endValue, "endValue must not be null");
        Objects.requireNonNull(snapshots, "snapshots must not be null");

        BigDecimal growth = BigDecimal.ONE;
        BigDecimal periodStartValue = startValue;
        int measuredPeriods = 0;

        List<ValuationSnapshot> ordered = snapshots.stream()
                .sorted(Comparator.comparing(ValuationSnapshot::date))
                .toList();

        for (ValuationSnapshot snapshot : ordered) {
            if (periodStartValue.signum() > 0) {
                growth = growth.multiply(DecimalMath.divide(snapshot.valueBeforeFlow(), periodStartValue));
                measuredPeriods++;
            }
            periodStartValue = snapshot.valueAfterFlow();
        }

        if (periodStartValue.signum() > 0) {
            growth = growth.multiply(DecimalMath.divide(endValue, periodStartValue));
            measuredPeriods++;
        }

        if (measuredPeriods == 0) {
            return Optional.empty();
        }
        return Optional.of(growth.subtract(BigDecimal.ONE));
    }
}
