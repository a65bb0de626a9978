package com.infragraph.expander.foreach;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for a {@link ForeachModuleHandler} run.
 */
@Value
@Builder(toBuilder = true)
public class ExpanderConfig {

    /**
     * Upper bound on scheduler rounds. The nesting depth of real configurations is far
     * below this; hitting it is logged as a warning.
     */
    @Builder.Default
    int maxRounds = 64;

    /**
     * Retry modules whose statement was not static in a later round.
     */
    @Builder.Default
    boolean retryUnresolved = true;

    /**
     * Check membership consistency after the run and log any violation.
     */
    @Builder.Default
    boolean verifyMembership = false;

    public static ExpanderConfig defaults() {
        return ExpanderConfig.builder().build();
    }
}
