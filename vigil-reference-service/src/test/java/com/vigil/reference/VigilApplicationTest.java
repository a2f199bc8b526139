package com.vigil.reference;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class VigilApplicationTest {

    @Test
    void formatsMemorySizes() {
        assertThat(VigilApplication.formatBytes(512)).isEqualTo("512 bytes");
        assertThat(VigilApplication.formatBytes(3L * 1_048_576L)).isEqualTo("3.00 MB");
        assertThat(VigilApplication.formatBytes(2L * 1_073_741_824L)).isEqualTo("2.00 GB");
    }
}
