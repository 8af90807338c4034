/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.inspector;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InspectorOptionsTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(InspectorOptions.MISMATCH_POLICY_PROPERTY);
    }

    @Test
    void testDefaultsFail() {
        assertThat(InspectorOptions.defaults().mismatchPolicy()).isEqualTo(MismatchPolicy.FAIL);
        assertThat(InspectorOptions.fromSystemProperties().mismatchPolicy()).isEqualTo(MismatchPolicy.FAIL);
    }

    @Test
    void testPolicyFromSystemProperty() {
        System.setProperty(InspectorOptions.MISMATCH_POLICY_PROPERTY, " Warn ");
        assertThat(InspectorOptions.fromSystemProperties().mismatchPolicy()).isEqualTo(MismatchPolicy.WARN);

        System.setProperty(InspectorOptions.MISMATCH_POLICY_PROPERTY, "fail");
        assertThat(InspectorOptions.fromSystemProperties().mismatchPolicy()).isEqualTo(MismatchPolicy.FAIL);
    }

    @Test
    void testInvalidSystemProperty() {
        System.setProperty(InspectorOptions.MISMATCH_POLICY_PROPERTY, "ignore");

        assertThatThrownBy(InspectorOptions::fromSystemProperties)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ignore");
    }

    @Test
    void testWithMismatchPolicy() {
        InspectorOptions options = InspectorOptions.defaults().withMismatchPolicy(MismatchPolicy.WARN);

        assertThat(options.mismatchPolicy()).isEqualTo(MismatchPolicy.WARN);
        assertThat(InspectorOptions.defaults().mismatchPolicy()).isEqualTo(MismatchPolicy.FAIL);
        assertThatThrownBy(() -> options.withMismatchPolicy(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
