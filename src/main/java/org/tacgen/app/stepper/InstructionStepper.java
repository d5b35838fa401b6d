package org.tacgen.app.stepper;

import org.tacgen.backend.tac.Instruction;
import org.tacgen.core.Configuration;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Walks an instruction listing one step at a time, by hand or on a timer.
 * <p>
 * The current step is always within {@code [0, size-1]}. While playing, the stepper advances
 * once per delay and stops by itself on the last step. Starting playback from the last step
 * rewinds to the first one.
 * <p>
 * State changes are synchronized on the stepper; listeners are called on the thread that
 * caused the change, which for playback is the scheduler thread.
 */
public class InstructionStepper implements AutoCloseable {

    private final List<Instruction> instructions;
    private final ScheduledExecutorService scheduler;
    private final List<StepListener> listeners = new CopyOnWriteArrayList<>();

    private int currentStep = 0;
    private boolean playing = false;
    private int delayMillis = Configuration.DEFAULT_STEP_DELAY_MILLIS;
    private ScheduledFuture<?> pendingAdvance;

    /**
     * @param instructions a non-empty listing, as produced by the code generator
     */
    public InstructionStepper(List<Instruction> instructions) {
        if (instructions.isEmpty()) {
            throw new IllegalArgumentException("Nothing to step through: the instruction listing is empty");
        }
        this.instructions = List.copyOf(instructions);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "tacgen-stepper");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void addListener(StepListener listener) {
        listeners.add(listener);
    }

    public List<Instruction> instructions() {
        return instructions;
    }

    public synchronized int currentStep() {
        return currentStep;
    }

    public synchronized Instruction current() {
        return instructions.get(currentStep);
    }

    public synchronized boolean isPlaying() {
        return playing;
    }

    public synchronized int delayMillis() {
        return delayMillis;
    }

    public synchronized boolean hasPrevious() {
        return currentStep > 0;
    }

    public synchronized boolean hasNext() {
        return currentStep < lastStep();
    }

    /**
     * Moves to the given step, clamped into the listing.
     */
    public void stepTo(int step) {
        int newStep;
        synchronized (this) {
            currentStep = Math.max(0, Math.min(step, lastStep()));
            newStep = currentStep;
        }
        fireStepChanged(newStep);
    }

    public void previous() {
        stepTo(currentStep() - 1);
    }

    public void next() {
        stepTo(currentStep() + 1);
    }

    /**
     * Stops playback and returns to the first step.
     */
    public void reset() {
        synchronized (this) {
            stopPlayback();
            currentStep = 0;
        }
        fireStepChanged(0);
    }

    /**
     * Starts or pauses playback.
     *
     * @return true if the stepper is playing afterwards
     */
    public boolean togglePlay() {
        boolean rewound = false;
        boolean nowPlaying;
        synchronized (this) {
            if (playing) {
                stopPlayback();
                return false;
            }
            if (currentStep >= lastStep()) {
                currentStep = 0;
                rewound = true;
            }
            playing = true;
            scheduleAdvance();
            nowPlaying = playing;
        }
        if (rewound) {
            fireStepChanged(0);
        }
        return nowPlaying;
    }

    /**
     * Sets the playback delay, clamped to the configured bounds. A running playback picks
     * it up on its next step.
     */
    public synchronized void setDelayMillis(int delayMillis) {
        this.delayMillis = Configuration.clampStepDelay(delayMillis);
    }

    @Override
    public void close() {
        synchronized (this) {
            stopPlayback();
        }
        scheduler.shutdownNow();
    }

    private int lastStep() {
        return instructions.size() - 1;
    }

    // Caller holds the monitor
    private void scheduleAdvance() {
        if (currentStep >= lastStep()) {
            playing = false;
            return;
        }
        pendingAdvance = scheduler.schedule(this::advance, delayMillis, TimeUnit.MILLISECONDS);
    }

    // Caller holds the monitor
    private void stopPlayback() {
        playing = false;
        if (pendingAdvance != null) {
            pendingAdvance.cancel(false);
            pendingAdvance = null;
        }
    }

    private void advance() {
        int newStep;
        synchronized (this) {
            if (!playing) {
                return;
            }
            currentStep++;
            newStep = currentStep;
            scheduleAdvance();
        }
        fireStepChanged(newStep);
    }

    private void fireStepChanged(int step) {
        Instruction instruction = instructions.get(step);
        for (StepListener listener : listeners) {
            listener.stepChanged(step, instruction);
        }
    }
}
