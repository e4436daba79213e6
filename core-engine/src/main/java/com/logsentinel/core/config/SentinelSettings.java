package com.logsentinel.core.config;

import com.logsentinel.core.model.LogClass;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the pipeline YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional and defaults as shown):
 * </p>
 *
 * <pre>
 * calibration:
 *   initialThreshold: 0.5
 *   recalibrationIntervalSeconds: 300
 *   windowCapacity: 1000
 *   candidateStep: 0.1
 *   thresholdStatePath: ""
 * alerting:
 *   alertClasses: [1, 2]
 * delivery:
 *   maxRetries: 4
 *   retryDelayMillis: 2000
 *   requestTimeoutMillis: 5000
 *   closeTimeoutMillis: 30000
 *   backlog: 10000
 * feed:
 *   capacity: 100
 * store:
 *   entryRetention: 10000
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private Calibration calibration = new Calibration();
    private Alerting alerting = new Alerting();
    private Delivery delivery = new Delivery();
    private Feed feed = new Feed();
    private Store store = new Store();

    public Calibration getCalibration() {
        return calibration;
    }

    public void setCalibration(Calibration calibration) {
        this.calibration = calibration != null ? calibration : new Calibration();
    }

    public Alerting getAlerting() {
        return alerting;
    }

    public void setAlerting(Alerting alerting) {
        this.alerting = alerting != null ? alerting : new Alerting();
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public void setDelivery(Delivery delivery) {
        this.delivery = delivery != null ? delivery : new Delivery();
    }

    public Feed getFeed() {
        return feed;
    }

    public void setFeed(Feed feed) {
        this.feed = feed != null ? feed : new Feed();
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store != null ? store : new Store();
    }

    /**
     * Validate every section. Collects all errors and throws a single
     * exception if any value is out of range.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        double t = calibration.getInitialThreshold();
        if (Double.isNaN(t) || t < 0 || t > 1) {
            errors.add("calibration.initialThreshold must be in [0, 1], got: " + t);
        }
        if (calibration.getRecalibrationIntervalSeconds() < 0) {
            errors.add("calibration.recalibrationIntervalSeconds must be >= 0");
        }
        if (calibration.getWindowCapacity() <= 0) {
            errors.add("calibration.windowCapacity must be > 0");
        }
        double step = calibration.getCandidateStep();
        if (!(step > 0 && step <= 1)) {
            errors.add("calibration.candidateStep must be in (0, 1], got: " + step);
        }

        if (alerting.getAlertClasses() == null) {
            errors.add("alerting.alertClasses must not be null");
        } else {
            for (Integer id : alerting.getAlertClasses()) {
                if (id == null || LogClass.fromId(id).isEmpty()) {
                    errors.add("alerting.alertClasses contains unknown class id: " + id);
                }
            }
        }

        if (delivery.getMaxRetries() < 0) {
            errors.add("delivery.maxRetries must be >= 0");
        }
        if (delivery.getRetryDelayMillis() < 0) {
            errors.add("delivery.retryDelayMillis must be >= 0");
        }
        if (delivery.getRequestTimeoutMillis() <= 0) {
            errors.add("delivery.requestTimeoutMillis must be > 0");
        }
        if (delivery.getCloseTimeoutMillis() < 0) {
            errors.add("delivery.closeTimeoutMillis must be >= 0");
        }
        if (delivery.getBacklog() < 1) {
            errors.add("delivery.backlog must be >= 1");
        }
        if (feed.getCapacity() <= 0) {
            errors.add("feed.capacity must be > 0");
        }
        if (store.getEntryRetention() <= 0) {
            errors.add("store.entryRetention must be > 0");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Pipeline configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "SentinelSettings{calibration=" + calibration + ", alerting=" + alerting
                + ", delivery=" + delivery + ", feed=" + feed + ", store=" + store + '}';
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /** Threshold calibrator tunables. */
    public static class Calibration implements Serializable {

        private static final long serialVersionUID = 1L;

        private double initialThreshold = 0.5;
        private long recalibrationIntervalSeconds = 300;
        private int windowCapacity = 1000;
        private double candidateStep = 0.1;
        private String thresholdStatePath = "";

        public double getInitialThreshold() {
            return initialThreshold;
        }

        public void setInitialThreshold(double initialThreshold) {
            this.initialThreshold = initialThreshold;
        }

        public long getRecalibrationIntervalSeconds() {
            return recalibrationIntervalSeconds;
        }

        public void setRecalibrationIntervalSeconds(long recalibrationIntervalSeconds) {
            this.recalibrationIntervalSeconds = recalibrationIntervalSeconds;
        }

        public int getWindowCapacity() {
            return windowCapacity;
        }

        public void setWindowCapacity(int windowCapacity) {
            this.windowCapacity = windowCapacity;
        }

        public double getCandidateStep() {
            return candidateStep;
        }

        public void setCandidateStep(double candidateStep) {
            this.candidateStep = candidateStep;
        }

        /** Blank disables threshold persistence. */
        public String getThresholdStatePath() {
            return thresholdStatePath;
        }

        public void setThresholdStatePath(String thresholdStatePath) {
            this.thresholdStatePath = thresholdStatePath != null ? thresholdStatePath : "";
        }

        @Override
        public String toString() {
            return "Calibration{initialThreshold=" + initialThreshold
                    + ", intervalSeconds=" + recalibrationIntervalSeconds
                    + ", windowCapacity=" + windowCapacity
                    + ", candidateStep=" + candidateStep + '}';
        }
    }

    /** Alert policy tunables. */
    public static class Alerting implements Serializable {

        private static final long serialVersionUID = 1L;

        private List<Integer> alertClasses = new ArrayList<>(List.of(1, 2));

        public List<Integer> getAlertClasses() {
            return alertClasses;
        }

        public void setAlertClasses(List<Integer> alertClasses) {
            this.alertClasses = alertClasses != null ? new ArrayList<>(alertClasses) : new ArrayList<>();
        }

        @Override
        public String toString() {
            return "Alerting{alertClasses=" + alertClasses + '}';
        }
    }

    /** Collector delivery tunables. */
    public static class Delivery implements Serializable {

        private static final long serialVersionUID = 1L;

        private int maxRetries = 4;
        private long retryDelayMillis = 2000;
        private long requestTimeoutMillis = 5000;
        private long closeTimeoutMillis = 30_000;
        private int backlog = 10_000;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryDelayMillis() {
            return retryDelayMillis;
        }

        public void setRetryDelayMillis(long retryDelayMillis) {
            this.retryDelayMillis = retryDelayMillis;
        }

        public long getRequestTimeoutMillis() {
            return requestTimeoutMillis;
        }

        public void setRequestTimeoutMillis(long requestTimeoutMillis) {
            this.requestTimeoutMillis = requestTimeoutMillis;
        }

        public long getCloseTimeoutMillis() {
            return closeTimeoutMillis;
        }

        public void setCloseTimeoutMillis(long closeTimeoutMillis) {
            this.closeTimeoutMillis = closeTimeoutMillis;
        }

        /** Payloads that may wait for delivery; later ones are dropped. */
        public int getBacklog() {
            return backlog;
        }

        public void setBacklog(int backlog) {
            this.backlog = backlog;
        }

        @Override
        public String toString() {
            return "Delivery{maxRetries=" + maxRetries + ", retryDelayMillis=" + retryDelayMillis
                    + ", requestTimeoutMillis=" + requestTimeoutMillis + ", backlog=" + backlog + '}';
        }
    }

    /** Live feed tunables. */
    public static class Feed implements Serializable {

        private static final long serialVersionUID = 1L;

        private int capacity = 100;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        @Override
        public String toString() {
            return "Feed{capacity=" + capacity + '}';
        }
    }

    /** In-memory store tunables. */
    public static class Store implements Serializable {

        private static final long serialVersionUID = 1L;

        private int entryRetention = 10_000;

        public int getEntryRetention() {
            return entryRetention;
        }

        public void setEntryRetention(int entryRetention) {
            this.entryRetention = entryRetention;
        }

        @Override
        public String toString() {
            return "Store{entryRetention=" + entryRetention + '}';
        }
    }
}
