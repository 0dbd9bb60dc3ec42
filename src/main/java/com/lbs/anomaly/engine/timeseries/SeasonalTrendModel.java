package com.lbs.anomaly.engine.timeseries;

import com.lbs.anomaly.exception.ComputationException;
import com.lbs.anomaly.exception.InsufficientDataException;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Additive daily model: piecewise-free linear trend plus Fourier seasonality
 * (weekly, and yearly when asked), fitted by ordinary least squares.
 * The prediction interval is {@code yhat ± z * sigma} with sigma the residual standard error.
 */
public final class SeasonalTrendModel {

    private static final Logger log = LoggerFactory.getLogger(SeasonalTrendModel.class);

    static final int WEEKLY_ORDER = 3;
    static final int YEARLY_ORDER = 10;
    private static final double WEEK = 7.0;
    private static final double YEAR = 365.25;

    private final LocalDate origin;
    private final double span;
    private final int weeklyOrder;
    private final int yearlyOrder;
    private final double[] beta;
    private final double sigma;
    private final double z;

    private SeasonalTrendModel(LocalDate origin, double span, int weeklyOrder, int yearlyOrder,
                               double[] beta, double sigma, double z) {
        this.origin = origin;
        this.span = span;
        this.weeklyOrder = weeklyOrder;
        this.yearlyOrder = yearlyOrder;
        this.beta = beta;
        this.sigma = sigma;
        this.z = z;
    }

    /**
     * Fits the model on dated observations (ascending, one per day at most).
     *
     * @param yearly        include yearly seasonality terms
     * @param intervalWidth coverage of the prediction interval, in (0, 1)
     */
    public static SeasonalTrendModel fit(List<LocalDate> dates, double[] values, boolean yearly, double intervalWidth) {
        int n = values.length;
        LocalDate origin = dates.get(0);
        double span = Math.max(1.0, ChronoUnit.DAYS.between(origin, dates.get(n - 1)));
        double z = new NormalDistribution(0, 1).inverseCumulativeProbability(0.5 + intervalWidth / 2.0);

        int weeklyOrder = WEEKLY_ORDER;
        int yearlyOrder = yearly ? YEARLY_ORDER : 0;
        // Keep at least two residual degrees of freedom.
        while (n <= regressors(weeklyOrder, yearlyOrder) + 2 && (yearlyOrder > 0 || weeklyOrder > 0)) {
            if (yearlyOrder > 0) yearlyOrder--;
            else weeklyOrder--;
        }
        if (n <= regressors(weeklyOrder, yearlyOrder) + 2) {
            throw new InsufficientDataException("Too few observations to fit a trend", n,
                    regressors(weeklyOrder, yearlyOrder) + 3);
        }

        try {
            return solve(dates, values, origin, span, weeklyOrder, yearlyOrder, z);
        } catch (SingularMatrixException e) {
            // Sparse dates can make the seasonal columns collinear; a plain trend still fits.
            log.debug("Seasonal design matrix is singular, refitting trend only: {}", e.getMessage());
            try {
                return solve(dates, values, origin, span, 0, 0, z);
            } catch (SingularMatrixException again) {
                throw new ComputationException("Forecast model could not be fitted", again);
            }
        }
    }

    private static SeasonalTrendModel solve(List<LocalDate> dates, double[] values, LocalDate origin, double span,
                                            int weeklyOrder, int yearlyOrder, double z) {
        double[][] x = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            x[i] = features(dates.get(i), origin, span, weeklyOrder, yearlyOrder);
        }
        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
        regression.newSampleData(values, x);
        double[] beta = regression.estimateRegressionParameters();
        double variance = regression.estimateErrorVariance();
        double sigma = Double.isFinite(variance) && variance > 0 ? Math.sqrt(variance) : 0.0;
        return new SeasonalTrendModel(origin, span, weeklyOrder, yearlyOrder, beta, sigma, z);
    }

    private static int regressors(int weeklyOrder, int yearlyOrder) {
        return 1 + 2 * weeklyOrder + 2 * yearlyOrder;
    }

    private static double[] features(LocalDate date, LocalDate origin, double span, int weeklyOrder, int yearlyOrder) {
        double[] row = new double[regressors(weeklyOrder, yearlyOrder)];
        row[0] = ChronoUnit.DAYS.between(origin, date) / span;
        double day = date.toEpochDay();
        int col = 1;
        for (int k = 1; k <= weeklyOrder; k++) {
            row[col++] = Math.sin(2 * Math.PI * k * day / WEEK);
            row[col++] = Math.cos(2 * Math.PI * k * day / WEEK);
        }
        for (int k = 1; k <= yearlyOrder; k++) {
            row[col++] = Math.sin(2 * Math.PI * k * day / YEAR);
            row[col++] = Math.cos(2 * Math.PI * k * day / YEAR);
        }
        return row;
    }

    public Prediction predict(LocalDate date) {
        double[] row = features(date, origin, span, weeklyOrder, yearlyOrder);
        double yhat = beta[0];
        for (int i = 0; i < row.length; i++) {
            yhat += beta[i + 1] * row[i];
        }
        double trend = beta[0] + beta[1] * row[0];
        double half = z * sigma;
        return new Prediction(yhat, yhat - half, yhat + half, trend);
    }

    public double getSigma() {
        return sigma;
    }

    public boolean hasWeeklySeasonality() {
        return weeklyOrder > 0;
    }

    public boolean hasYearlySeasonality() {
        return yearlyOrder > 0;
    }

    public record Prediction(double yhat, double lower, double upper, double trend) {}
}
