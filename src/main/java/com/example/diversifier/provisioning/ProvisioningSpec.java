package com.example.diversifier.provisioning;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * How to build one long-lived component: an optional preferred (enhanced) variant,
 * the baseline variant, and the fallback handed out while construction keeps failing.
 */
public final class ProvisioningSpec<T> {

    private final Supplier<? extends T> preferred;
    private final Supplier<? extends T> baseline;
    private final Supplier<? extends T> fallback;

    private ProvisioningSpec(Supplier<? extends T> preferred, Supplier<? extends T> baseline,
                             Supplier<? extends T> fallback) {
        this.preferred = preferred;
        this.baseline = Objects.requireNonNull(baseline, "baseline");
        this.fallback = fallback;
    }

    public static <T> ProvisioningSpec<T> of(Supplier<? extends T> baseline) {
        return new ProvisioningSpec<>(null, baseline, null);
    }

    public ProvisioningSpec<T> preferring(Supplier<? extends T> enhanced) {
        return new ProvisioningSpec<>(enhanced, baseline, fallback);
    }

    public ProvisioningSpec<T> withFallback(Supplier<? extends T> whileFailing) {
        return new ProvisioningSpec<>(preferred, baseline, whileFailing);
    }

    Supplier<? extends T> preferred() {
        return preferred;
    }

    Supplier<? extends T> baseline() {
        return baseline;
    }

    Supplier<? extends T> fallback() {
        return fallback;
    }
}
