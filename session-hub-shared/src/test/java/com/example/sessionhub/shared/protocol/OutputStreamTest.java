package com.example.sessionhub.shared.protocol;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputStreamTest {

    @Test
    void resolvesWireNamesAndAliases() {
        assertThat(OutputStream.fromWireName("stdout")).isEqualTo(OutputStream.STDOUT);
        assertThat(OutputStream.fromWireName("primary")).isEqualTo(OutputStream.STDOUT);
        assertThat(OutputStream.fromWireName("STDERR")).isEqualTo(OutputStream.STDERR);
        assertThat(OutputStream.fromWireName("error")).isEqualTo(OutputStream.STDERR);
    }

    @Test
    void rejectsUnknownStream() {
        assertThatThrownBy(() -> OutputStream.fromWireName("stdin"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("stdin");
    }
}
