package com.delta.siteaudit.audit.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AuditModeTest {

    @Test
    void blankModeDefaultsToSingle() {
        assertThat(AuditMode.fromValue(null)).isEqualTo(AuditMode.SINGLE);
        assertThat(AuditMode.fromValue(" ")).isEqualTo(AuditMode.SINGLE);
        assertThat(new AuditRequest("example.com", null).mode()).isEqualTo(AuditMode.SINGLE);
    }

    @Test
    void parsesCaseInsensitively() {
        assertThat(AuditMode.fromValue("full")).isEqualTo(AuditMode.FULL);
    }

    @Test
    void unknownModeIsRejected() {
        assertThatThrownBy(() -> AuditMode.fromValue("deep"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("deep");
    }
}
