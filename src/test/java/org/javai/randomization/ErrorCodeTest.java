package org.javai.randomization;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ErrorCodeTest {

    @Test
    void toString_joinsNamespaceAndName() {
        assertThat(ErrorCode.of("config", "block_size")).hasToString("config:block_size");
    }

    @Test
    void rejectsBlankParts() {
        assertThatThrownBy(() -> ErrorCode.of(" ", "x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("namespace must not be blank");
        assertThatThrownBy(() -> ErrorCode.of("config", ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name must not be blank");
    }

    @Test
    void exceptionsCarryTheirFamily() {
        assertThat(new ConfigurationException("groups", "bad").code().namespace()).isEqualTo("config");
        assertThat(new ParticipantLookupException("cluster", "P1", "bad").code().namespace()).isEqualTo("lookup");
        assertThat(new DataIntegrityException("missing", List.of("P1"), "bad").code().namespace()).isEqualTo("integrity");
    }

    @Test
    void exceptionsAreRandomizationExceptions() {
        assertThat(new ConfigurationException("groups", "bad"))
                .isInstanceOf(RandomizationException.class)
                .isInstanceOf(RuntimeException.class)
                .hasMessage("bad");
    }
}
