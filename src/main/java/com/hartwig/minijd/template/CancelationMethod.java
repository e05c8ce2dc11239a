package com.hartwig.minijd.template;

import java.util.Optional;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import org.immutables.value.Value;

@Value.Immutable
@Value.Style(jdkOnly = true)
@JsonDeserialize(as = ImmutableCancelationMethod.class)
@JsonSerialize(as = ImmutableCancelationMethod.class)
public interface CancelationMethod {
    CancelationMode mode();

    /**
     * Grace period between the notification and the forced termination, NOTIFY_THEN_TERMINATE only.
     */
    Optional<Integer> notifyPeriodInSeconds();

    static CancelationMethod terminate() {
        return ImmutableCancelationMethod.builder().mode(CancelationMode.TERMINATE).build();
    }

    static CancelationMethod notifyThenTerminate(int notifyPeriodInSeconds) {
        return ImmutableCancelationMethod.builder()
                .mode(CancelationMode.NOTIFY_THEN_TERMINATE)
                .notifyPeriodInSeconds(notifyPeriodInSeconds)
                .build();
    }
}
