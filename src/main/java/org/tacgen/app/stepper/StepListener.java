package org.tacgen.app.stepper;

import org.tacgen.backend.tac.Instruction;

/**
 * Notified whenever the current step of an {@link InstructionStepper} changes.
 */
@FunctionalInterface
public interface StepListener {

    void stepChanged(int step, Instruction instruction);
}
