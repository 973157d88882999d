package com.phillippitts.lossguard.service.monitor;

import com.phillippitts.lossguard.domain.AnomalyKind;
import com.phillippitts.lossguard.domain.RunLengthAccessor;
import com.phillippitts.lossguard.domain.StepLoss;
import com.phillippitts.lossguard.domain.StepOutcome;
import com.phillippitts.lossguard.exception.HighLossException;
import com.phillippitts.lossguard.exception.InvalidLossException;
import com.phillippitts.lossguard.exception.LossSpikeException;
import com.phillippitts.lossguard.exception.TerminalRunException;
import com.phillippitts.lossguard.service.metrics.MonitorMetricsPublisher;
import com.phillippitts.lossguard.service.monitor.calibration.LossCalibrator;
import com.phillippitts.lossguard.service.monitor.detector.HighLossDetector;
import com.phillippitts.lossguard.service.monitor.detector.SpikeDetector;
import com.phillippitts.lossguard.service.monitor.window.RollingLossWindow;
import com.phillippitts.lossguard.service.telemetry.MetadataSink;
import com.phillippitts.lossguard.service.telemetry.TelemetryDestination;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Detects loss spikes and persistently high training loss, one step at a time.
 *
 * <p><b>Per-step protocol</b> ({@link #onBatchEnd(long, StepLoss)}):
 * <ol>
 *   <li>Non-coordinator processes return {@link StepOutcome#SKIPPED} immediately.</li>
 *   <li>The loss must be a single finite scalar, otherwise {@link InvalidLossException}.</li>
 *   <li>While the window is filling up the loss is only recorded.</li>
 *   <li>On the first full window the loss cap is calibrated, unless configured.</li>
 *   <li>The spike detector runs against the mean of the window; the high-loss detector runs
 *       only when no spike was found.</li>
 *   <li>The loss is added to the window.</li>
 * </ol>
 *
 * <p>On a detection every attached {@link MetadataSink} receives a diagnostic; unless the
 * monitor is log-only, a {@link TerminalRunException} then propagates to the caller.
 *
 * <p><b>Thread Safety:</b> none. A monitor is owned by one training loop and called
 * synchronously; callers from several threads must serialize access.
 *
 * @since 1.0
 * @see LossSpikeMonitorBuilder
 */
public final class LossSpikeMonitor implements TrainingLoopListener {

    private static final Logger LOG = LogManager.getLogger(LossSpikeMonitor.class);

    public static final String LOSS_WINDOW_KEY = "loss_window";

    private final MonitorSettings settings;
    private final boolean coordinator;
    private final List<TelemetryDestination> destinations;
    private final MonitorMetricsPublisher metricsPublisher;
    private final LossCalibrator calibrator;
    private final SpikeDetector spikeDetector;
    private final HighLossDetector highLossDetector = new HighLossDetector();

    private int windowSize;
    private double lossCap;
    private boolean windowSizeCalibrated;
    private boolean lossCapCalibrated;
    private boolean runStarted;
    private RollingLossWindow window;

    private long stepsObserved;
    private long lastStep = -1;
    private StepOutcome lastOutcome;
    private AnomalyKind lastAnomaly;
    private boolean terminated;

    LossSpikeMonitor(MonitorSettings settings,
                     boolean coordinator,
                     List<TelemetryDestination> destinations,
                     MonitorMetricsPublisher metricsPublisher) {
        this.settings = settings;
        this.coordinator = coordinator;
        this.destinations = List.copyOf(destinations);
        this.metricsPublisher = metricsPublisher;
        this.calibrator = settings.calibrator();
        this.spikeDetector = new SpikeDetector(settings.outlierMultiplier(), settings.patience());
        this.windowSize = settings.isWindowSizeUserDefined() ? settings.windowSize() : calibrator.minWindowSize();
        this.lossCap = settings.isLossCapUserDefined() ? settings.lossCap() : calibrator.maxLossCap();
        this.window = new RollingLossWindow(windowSize);
        LOG.info("Loss spike monitor created: coordinator={}, logOnly={}, patience={}, outlierMultiplier={}, "
                        + "windowSize={}{}, lossCap={}{}",
                coordinator, settings.logOnly(), settings.patience(), settings.outlierMultiplier(),
                windowSize, settings.isWindowSizeUserDefined() ? "" : " (auto)",
                lossCap, settings.isLossCapUserDefined() ? "" : " (auto)");
    }

    /**
     * Sizes the rolling window from the planned run length, unless the window size was configured.
     *
     * <p>Handled once; repeated calls are ignored.
     *
     * @param runLength estimate of total planned steps
     * @throws IllegalStateException if steps were already processed
     */
    @Override
    public void onRunStart(RunLengthAccessor runLength) {
        if (!coordinator) {
            return;
        }
        if (stepsObserved > 0) {
            throw new IllegalStateException("Run start must be reported before the first training step ("
                    + stepsObserved + " steps already observed)");
        }
        if (runStarted) {
            LOG.warn("Run start already handled; keeping window size {}", windowSize);
            return;
        }
        runStarted = true;
        if (settings.isWindowSizeUserDefined()) {
            LOG.info("Using configured loss window size {}", windowSize);
            return;
        }
        OptionalLong totalSteps = runLength == null ? OptionalLong.empty() : runLength.totalPlannedSteps();
        windowSize = calibrator.windowSizeFor(totalSteps);
        window = new RollingLossWindow(windowSize);
        windowSizeCalibrated = true;
        if (totalSteps.isPresent()) {
            LOG.info("Calibrated loss window size to {} for {} planned steps", windowSize, totalSteps.getAsLong());
        } else {
            LOG.info("Run length unknown; using minimum loss window size {}", windowSize);
        }
    }

    /**
     * Convenience overload for a scalar loss.
     */
    public StepOutcome onBatchEnd(long step, double loss) {
        return onBatchEnd(step, StepLoss.of(loss));
    }

    /**
     * Feeds one training step into the monitor.
     *
     * @param step index of the step (0-based count of previously completed steps)
     * @param loss the step's loss
     * @return outcome of the step
     * @throws InvalidLossException if the loss is not a single finite scalar
     * @throws LossSpikeException on a loss spike, unless log-only
     * @throws HighLossException on persistently high loss, unless log-only
     */
    @Override
    public StepOutcome onBatchEnd(long step, StepLoss loss) {
        if (!coordinator) {
            metricsPublisher.recordStep(StepOutcome.SKIPPED, 0L);
            return StepOutcome.SKIPPED;
        }
        if (loss == null) {
            throw new InvalidLossException("loss is null");
        }
        double trainLoss = loss.scalar();
        long started = System.nanoTime();
        stepsObserved++;
        lastStep = step;

        // Only start detection once a full window of loss data is available
        if (!window.isFull()) {
            window.push(trainLoss);
            return complete(StepOutcome.WARMING_UP, started);
        }
        if (!settings.isLossCapUserDefined() && !lossCapCalibrated) {
            calibrateLossCap(step);
        }

        double runningLossAvg = window.mean();
        LOG.debug("Running loss average: {}", runningLossAvg);

        AnomalyKind anomaly = null;
        if (spikeDetector.detect(trainLoss, runningLossAvg)) {
            anomaly = AnomalyKind.LOSS_SPIKE;
        } else if (highLossDetector.detect(window, step, lossCap, windowSize)) {
            anomaly = AnomalyKind.HIGH_LOSS;
        }

        if (anomaly == null) {
            window.push(trainLoss);
            return complete(StepOutcome.NORMAL, started);
        }

        report(anomaly, step, runningLossAvg);
        window.push(trainLoss);
        StepOutcome outcome = complete(StepOutcome.of(anomaly), started);
        if (!settings.logOnly()) {
            terminated = true;
            throw terminalCondition(anomaly, runningLossAvg);
        }
        return outcome;
    }

    public MonitorStatus status() {
        return new MonitorStatus(coordinator, settings.logOnly(), windowSize, windowSizeCalibrated,
                lossCap, lossCapCalibrated, window.size(), spikeDetector.outlierCounter(),
                stepsObserved, lastStep, lastOutcome, lastAnomaly, terminated);
    }

    public MonitorSettings settings() {
        return settings;
    }

    public boolean isCoordinator() {
        return coordinator;
    }

    public int windowSize() {
        return windowSize;
    }

    public double lossCap() {
        return lossCap;
    }

    public int outlierCounter() {
        return spikeDetector.outlierCounter();
    }

    public List<Double> windowSnapshot() {
        return window.snapshot();
    }

    private void calibrateLossCap(long step) {
        lossCap = calibrator.lossCapFor(window.snapshot());
        lossCapCalibrated = true;
        LOG.info("Calibrated loss cap to {} at step {}", lossCap, step);
    }

    private StepOutcome complete(StepOutcome outcome, long startedNanos) {
        lastOutcome = outcome;
        metricsPublisher.recordStep(outcome, System.nanoTime() - startedNanos);
        return outcome;
    }

    private void report(AnomalyKind kind, long step, double runningLossAvg) {
        lastAnomaly = kind;
        metricsPublisher.recordAnomaly(kind, settings.logOnly());

        Map<String, Object> context = new LinkedHashMap<>();
        context.put(LOSS_WINDOW_KEY, window.snapshot());
        context.put("step", step);
        String message;
        if (kind == AnomalyKind.LOSS_SPIKE) {
            message = "Training loss spike detected for " + spikeDetector.outlierCounter()
                    + " consecutive steps. Consider stopping this run and resubmitting with a lower learning rate.";
            context.put("outlier_counter", spikeDetector.outlierCounter());
            context.put("running_loss_avg", runningLossAvg);
        } else {
            message = "Persistently high (>" + lossCap + ") training losses detected. "
                    + "Consider stopping this run and resubmitting with a lower learning rate.";
            context.put("loss_cap", lossCap);
            context.put("window_size", windowSize);
        }
        Map<String, Object> readOnlyContext = Collections.unmodifiableMap(context);

        for (TelemetryDestination destination : destinations) {
            if (!(destination instanceof MetadataSink sink)) {
                continue;
            }
            try {
                sink.record(kind.metadataKey(), message, readOnlyContext);
            } catch (RuntimeException ex) {
                LOG.warn("Telemetry destination {} failed to record {}: {}",
                        destination.destinationName(), kind.metadataKey(), ex.toString());
            }
        }
    }

    private TerminalRunException terminalCondition(AnomalyKind kind, double runningLossAvg) {
        if (kind == AnomalyKind.LOSS_SPIKE) {
            return new LossSpikeException(settings.outlierMultiplier(), runningLossAvg,
                    spikeDetector.outlierCounter());
        }
        return new HighLossException(lossCap, windowSize);
    }
}
