package com.phillippitts.lossguard.service.ingest;

import com.phillippitts.lossguard.domain.RunLengthAccessor;
import com.phillippitts.lossguard.domain.StepLoss;
import com.phillippitts.lossguard.domain.StepOutcome;
import com.phillippitts.lossguard.service.monitor.LossSpikeMonitor;
import com.phillippitts.lossguard.service.monitor.MonitorStatus;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Feeds remotely reported training steps into the single {@link LossSpikeMonitor}.
 *
 * <p>The monitor itself is not thread-safe; HTTP requests arrive on arbitrary threads, so every
 * call is serialized with a {@link ReentrantLock}. Exceptions raised by the monitor propagate
 * unchanged.
 *
 * @since 1.0
 */
@Service
public class StepIngestService {

    private final Lock lock = new ReentrantLock();
    private final LossSpikeMonitor monitor;

    public StepIngestService(LossSpikeMonitor monitor) {
        this.monitor = Objects.requireNonNull(monitor, "monitor");
    }

    public void startRun(RunLengthAccessor runLength) {
        lock.lock();
        try {
            monitor.onRunStart(runLength);
        } finally {
            lock.unlock();
        }
    }

    public StepOutcome recordStep(long step, StepLoss loss) {
        lock.lock();
        try {
            return monitor.onBatchEnd(step, loss);
        } finally {
            lock.unlock();
        }
    }

    public MonitorStatus status() {
        lock.lock();
        try {
            return monitor.status();
        } finally {
            lock.unlock();
        }
    }
}
