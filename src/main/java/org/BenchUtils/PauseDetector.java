/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

package org.BenchUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A PauseDetector is the source of process-wide pause reports (e.g. collector or scheduler stalls) for
 * benchmarks. Subclasses observe pauses in whatever way suits them and call {@link #reportPause(long, long)}.
 * <p>
 * A {@link Benchmark} that is given a pause detector opens a recording window for its sampling phase
 * ({@link #startRecording()} / {@link #stopRecording(PauseRecorder)}). A pause counts against the window when
 * its end time falls inside it, regardless of when the report is dispatched, so pauses reported during warm-up
 * never leak into the samples' noise report.
 * <p>
 * Reports and window changes are queued and dispatched in order on the detector's own (daemon) thread, so
 * recording never runs on the thread being measured. {@link #stopRecording(PauseRecorder)} waits for every
 * report queued before it to be dispatched.
 * <p>
 * All times and time units are in nanoseconds
 */
public abstract class PauseDetector extends Thread {
    private static final Logger log = LoggerFactory.getLogger(PauseDetector.class);

    static final long DEFAULT_DrainTimeoutMsec = 1000;

    // Only touched by the dispatcher thread
    private final ArrayList<PauseRecorder> recorders = new ArrayList<PauseRecorder>(4);

    private final LinkedBlockingQueue<Object> messages = new LinkedBlockingQueue<Object>();

    volatile boolean stop = false;

    protected PauseDetector() {
        this.setDaemon(true);
        this.setName(getClass().getSimpleName() + "_dispatcher");
        this.start();
    }

    /**
     * Report a pause to the open recording windows.
     * @param pauseLength pause length
     * @param pauseEndTime time at the end of the pause, in {@link TimeServices#nanoTime()} units
     */
    protected void reportPause(final long pauseLength, final long pauseEndTime) {
        if (pauseLength < 0) {
            throw new IllegalArgumentException("pause length cannot be negative, was " + pauseLength);
        }
        messages.add(new PauseReport(pauseLength, pauseEndTime));
    }

    /**
     * Open a recording window starting now.
     * @return the recorder for the window, to be passed to {@link #stopRecording(PauseRecorder)}
     */
    PauseRecorder startRecording() {
        PauseRecorder recorder = new PauseRecorder(TimeServices.nanoTime());
        messages.add(new WindowChange(WindowChange.Command.OPEN, recorder));
        return recorder;
    }

    /**
     * Close a recording window, and summarize the pauses that ended inside it. Waits (for up to
     * {@link #DEFAULT_DrainTimeoutMsec} msec) for the reports queued before the window was closed.
     * @param recorder the recorder returned by {@link #startRecording()}
     * @return the pauses recorded in the window
     */
    PauseSummary stopRecording(final PauseRecorder recorder) {
        recorder.close(TimeServices.nanoTime());
        WindowChange closeRequest = new WindowChange(WindowChange.Command.CLOSE, recorder);
        messages.add(closeRequest);
        try {
            if (!closeRequest.dispatched.await(DEFAULT_DrainTimeoutMsec, TimeUnit.MILLISECONDS)) {
                log.warn("{} did not drain its pause reports in {} msec, pause summary may be incomplete",
                        getName(), DEFAULT_DrainTimeoutMsec);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        return recorder.summarize();
    }

    /**
     * Stop execution of this pause detector
     */
    public void shutdown() {
        stop = true;
        this.interrupt();
    }

    @Override
    public void run() {
        while (!stop) {
            try {
                dispatch(messages.take());
            } catch (InterruptedException ex) {
                if (!stop) {
                    log.debug("{} interrupted while waiting for pause reports", getName());
                }
            }
        }
        log.debug("{} terminated", getName());
    }

    private void dispatch(final Object message) {
        if (message instanceof PauseReport) {
            final PauseReport report = (PauseReport) message;
            log.debug("pause of {} nsec ended at {}", report.pauseLength, report.pauseEndTime);
            for (PauseRecorder recorder : recorders) {
                recorder.record(report.pauseLength, report.pauseEndTime);
            }
        } else if (message instanceof WindowChange) {
            final WindowChange change = (WindowChange) message;
            if (change.command == WindowChange.Command.OPEN) {
                recorders.add(change.recorder);
            } else {
                recorders.remove(change.recorder);
                change.dispatched.countDown();
            }
        } else {
            throw new IllegalStateException("Unexpected message type received: " + message);
        }
    }

    static class WindowChange {
        enum Command {OPEN, CLOSE}

        final Command command;
        final PauseRecorder recorder;
        final CountDownLatch dispatched = new CountDownLatch(1);

        WindowChange(final Command command, final PauseRecorder recorder) {
            this.command = command;
            this.recorder = recorder;
        }
    }

    static class PauseReport {
        final long pauseLength;
        final long pauseEndTime;

        PauseReport(final long pauseLength, final long pauseEndTime) {
            this.pauseLength = pauseLength;
            this.pauseEndTime = pauseEndTime;
        }
    }
}
