package com.driftindexer.ingestion.event;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiscriminatorTest {

    @Test
    void forEvent_isSha256PrefixOfEventName() {
        assertThat(Discriminator.forEvent("OrderActionRecord")).hasToString("e0344347c2ed6d01");
        assertThat(Discriminator.forEvent("OrderRecord")).hasToString("681340385915025a");
    }

    @Test
    void of_equalBytes_equalDiscriminators() {
        byte[] bytes = Discriminator.forEvent("OrderRecord").toByteArray();

        assertThat(Discriminator.of(bytes)).isEqualTo(Discriminator.forEvent("OrderRecord"));
        assertThat(Discriminator.of(bytes).hashCode()).isEqualTo(Discriminator.forEvent("OrderRecord").hashCode());
        assertThat(Discriminator.of(bytes)).isNotEqualTo(Discriminator.forEvent("OrderActionRecord"));
    }

    @Test
    void of_wrongLength_rejected() {
        assertThatThrownBy(() -> Discriminator.of(new byte[7])).isInstanceOf(IllegalArgumentException.class);
    }
}
