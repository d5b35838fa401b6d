package org.tacgen.app.stepper;

import org.tacgen.backend.tac.Instruction;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Plays an instruction listing on a console: each step prints the instruction, its
 * description and the source lines it highlights.
 */
public class ConsolePlayback {

    private final String sourceText;
    private final PrintStream out;

    public ConsolePlayback(String sourceText, PrintStream out) {
        this.sourceText = sourceText;
        this.out = out;
    }

    /**
     * Plays from the first step to {@code END} and returns once the last step was shown.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public void play(List<Instruction> instructions, int delayMillis) throws InterruptedException {
        CountDownLatch finished = new CountDownLatch(1);
        try (InstructionStepper stepper = new InstructionStepper(instructions)) {
            stepper.setDelayMillis(delayMillis);
            stepper.addListener((step, instruction) -> {
                printStep(step, instruction);
                if (step == instructions.size() - 1) {
                    finished.countDown();
                }
            });
            printStep(0, stepper.current());
            if (!stepper.togglePlay()) {
                // a listing of one instruction has nothing to play
                finished.countDown();
            }
            finished.await();
        }
    }

    public void printStep(int step, Instruction instruction) {
        out.println("-> " + instruction + "    [" + StepDescription.describe(instruction) + "]");
        String[] lines = sourceText.split("\n", -1);
        for (int index : SourceHighlighter.highlightedLines(sourceText, instruction)) {
            out.println("   source " + (index + 1) + ": " + lines[index].trim());
        }
    }
}
