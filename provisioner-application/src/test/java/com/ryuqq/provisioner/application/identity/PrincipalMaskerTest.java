package com.ryuqq.provisioner.application.identity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PrincipalMaskerTest {

    @Test
    void UPN은_앞_두글자와_도메인만_남김() {
        assertThat(PrincipalMasker.mask("alice.kim@example.com")).isEqualTo("al***@example.com");
    }

    @Test
    void 일반_식별자는_앞_8글자만_남김() {
        assertThat(PrincipalMasker.mask("0f8fad5b-d9cb-469f-a165-70867728950e")).isEqualTo("0f8fad5b***");
    }

    @Test
    void 짧은_식별자와_null() {
        assertThat(PrincipalMasker.mask("abc")).isEqualTo("abc***");
        assertThat(PrincipalMasker.mask(null)).isEqualTo("***");
    }
}
