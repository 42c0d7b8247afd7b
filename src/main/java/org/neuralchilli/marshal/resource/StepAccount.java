package org.neuralchilli.marshal.resource;

/**
 * Cumulative token accounting of one step across runs.
 */
public record StepAccount(
        long admissions,
        long denials,
        long throttles,
        long granted,
        long consumed
) {

    static final StepAccount EMPTY = new StepAccount(0, 0, 0, 0, 0);

    StepAccount admitted(long tokens) {
        return new StepAccount(admissions + 1, denials, throttles, granted + tokens, consumed);
    }

    StepAccount denied() {
        return new StepAccount(admissions, denials + 1, throttles, granted, consumed);
    }

    StepAccount consumed(long tokens, boolean throttled) {
        return new StepAccount(admissions, denials, throttles + (throttled ? 1 : 0), granted, consumed + tokens);
    }
}
