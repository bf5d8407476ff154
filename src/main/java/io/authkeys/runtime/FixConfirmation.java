package io.authkeys.runtime;

import java.util.List;

/** Gate between planning and uploading. Returning {@code false} leaves every remote file untouched. */
public interface FixConfirmation {
    boolean approve(List<RemediationPlan> plans) throws InterruptedException;

    static FixConfirmation always() {
        return plans -> true;
    }
}
