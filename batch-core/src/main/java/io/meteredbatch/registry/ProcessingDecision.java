package io.meteredbatch.registry;

public record ProcessingDecision(boolean needed, ProcessingReason reason) {
    static ProcessingDecision process(ProcessingReason reason) { return new ProcessingDecision(true, reason); }
    static ProcessingDecision skip(ProcessingReason reason) { return new ProcessingDecision(false, reason); }
}
