/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.inspector;

import java.util.Locale;

/**
 * Options for {@link DatasetInspector}.
 */
public final class InspectorOptions {

    static final String MISMATCH_POLICY_PROPERTY = "sapwood.compression.mismatch";

    private static final InspectorOptions DEFAULTS = new InspectorOptions(MismatchPolicy.FAIL);

    private final MismatchPolicy mismatchPolicy;

    private InspectorOptions(MismatchPolicy mismatchPolicy) {
        this.mismatchPolicy = mismatchPolicy;
    }

    public static InspectorOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Reads options from system properties; {@code sapwood.compression.mismatch} may be
     * {@code fail} (the default) or {@code warn}.
     */
    public static InspectorOptions fromSystemProperties() {
        String policy = System.getProperty(MISMATCH_POLICY_PROPERTY);
        if (policy == null || policy.isBlank()) {
            return DEFAULTS;
        }
        try {
            return new InspectorOptions(MismatchPolicy.valueOf(policy.trim().toUpperCase(Locale.ROOT)));
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value '" + policy + "' for " + MISMATCH_POLICY_PROPERTY
                    + ", expected 'fail' or 'warn'", e);
        }
    }

    public InspectorOptions withMismatchPolicy(MismatchPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Mismatch policy must not be null");
        }
        return new InspectorOptions(policy);
    }

    public MismatchPolicy mismatchPolicy() {
        return mismatchPolicy;
    }

    @Override
    public String toString() {
        return "InspectorOptions[mismatchPolicy=" + mismatchPolicy + "]";
    }
}
