package com.saludsync.reps.service;

import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

class AuditContextTest {

    @Test
    void usesCallerWhenPresentOtherwiseDefault() {
        AuditContext ctx = new AuditContext();
        ReflectionTestUtils.setField(ctx, "defaultUser", "robot");

        assertThat(ctx.actingUser("  maria ")).isEqualTo("maria");
        assertThat(ctx.actingUser(null)).isEqualTo("robot");
        assertThat(ctx.actingUser(" ")).isEqualTo("robot");
        assertThat(ctx.actingUser("x".repeat(150))).hasSize(100);
    }
}
