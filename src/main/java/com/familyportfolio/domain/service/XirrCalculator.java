package com.familyportfolio.domain.service;

import com.familyportfolio.domain.model.CashFlow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Annualized internal rate of return of irregularly dated cash flows.
 * <p>
 * Solves {@code sum(amount / (1 + r)^(days / 365)) = 0} with Newton-Raphson and falls back to
 * bisection over an expanding bracket. Every loop is bounded, so an unsolvable series yields
 * an empty result rather than spinning.
 */
public class XirrCalculator {

    private static final Logger log = LoggerFactory.getLogger(XirrCalculator.class);

    private static final double DAYS_PER_YEAR = 365.0;
    private static final double INITIAL_GUESS = 0.1;
    private static final int MAX_ITERATIONS = 100;
    private static final double TOLERANCE = 1e-7;
    private static final double MIN_DERIVATIVE = 1e-10;
    private static final double MIN_RATE = -0.999;
    private static final double MAX_RATE = 1e6;
    private static final double INITIAL_UPPER_BOUND = 10.0;

    public Optional<BigDecimal> calculateXirr(List<CashFlow> cashFlows) {
        Objects.requireNonNull(cashFlows, "cashFlows must not be null");

        if (cashFlows.size() < 2) {
            return Optional.empty();
        }

        List<CashFlow> ordered = cashFlows.stream()
                .sorted(Comparator.comparing(CashFlow::date))
                .toList();

        boolean hasInflow = ordered.stream().anyMatch(flow -> flow.amount().signum() > 0);
        boolean hasOutflow = ordered.stream().anyMatch(flow -> flow.amount().signum() < 0);
        if (!hasInflow || !hasOutflow) {
            return Optional.empty();
        }

        LocalDate firstDate = ordered.get(0).date();
        int size = ordered.size();
        double[] amounts = new double[size];
        double[] years = new double[size];
        for (int i = 0; i < size; i++) {
            amounts[i] = ordered.get(i).amount().doubleValue();
            years[i] = ChronoUnit.DAYS.between(firstDate, ordered.get(i).date()) / DAYS_PER_YEAR;
        }

        Double rate = newtonRaphson(amounts, years);
        if (rate == null) {
            log.debug("XIRR Newton-Raphson did not converge for {} cash flows, trying bisection", size);
            rate = bisection(amounts, years);
        }
        if (rate == null) {
            log.debug("XIRR has no root for {} cash flows", size);
            return Optional.empty();
        }

        return Optional.of(BigDecimal.valueOf(rate).setScale(6, RoundingMode.HALF_EVEN));
    }

    private Double newtonRaphson(double[] amounts, double[] years) {
        double rate = INITIAL_GUESS;

        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            double npv = netPresentValue(amounts, years, rate);
            if (Math.abs(npv) < TOLERANCE) {
                return rate;
            }

            double derivative = derivative(amounts, years, rate);
            if (Math.abs(derivative) < MIN_DERIVATIVE) {
                rate += 0.1;
                continue;
            }

            double nextRate = clamp(rate - npv / derivative);
            if (Double.isNaN(nextRate) || Double.isInfinite(nextRate)) {
                return null;
            }
            if (Math.abs(nextRate - rate) < TOLERANCE) {
                return nextRate;
            }
            rate = nextRate;
        }
        return null;
    }

    private Double bisection(double[] amounts, double[] years) {
        double low = MIN_RATE;
        double high = INITIAL_UPPER_BOUND;
        double npvLow = netPresentValue(amounts, years, low);
        double npvHigh = netPresentValue(amounts, years, high);

        while (Math.signum(npvLow) == Math.signum(npvHigh) && high < MAX_RATE) {
            high = Math.min(high * 10, MAX_RATE);
            npvHigh = netPresentValue(amounts, years, high);
        }
        if (Math.signum(npvLow) == Math.signum(npvHigh)) {
            return null;
        }

        double mid = low;
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            mid = (low + high) / 2;
            double npvMid = netPresentValue(amounts, years, mid);
            if (Math.abs(npvMid) < TOLERANCE) {
                return mid;
            }
            if (Math.signum(npvMid) == Math.signum(npvLow)) {
                low = mid;
                npvLow = npvMid;
            } else {
                high = mid;
            }
        }
        return mid;
    }

    private static double netPresentValue(double[] amounts, double[] years, double rate) {
        double npv = 0;
        for (int i = 0; i < amounts.length; i++) {
            npv += amounts[i] / Math.pow(1 + rate, years[i]);
        }
        return npv;
    }

    private static double derivative(double[] amounts, double[] years, double rate) {
        double result = 0;
        for (int i = 0; i < amounts.length; i++) {
            result -= years[i] * amounts[i] / Math.pow(1 + rate, years[i] + 1);
        }
        return result;
    }

    private static double clamp(double rate) {
        return Math.max(MIN_RATE, Math.min(MAX_RATE, rate));
    }
}
