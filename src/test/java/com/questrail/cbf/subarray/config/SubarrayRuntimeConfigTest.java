package com.questrail.cbf.subarray.config;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;

import static org.junit.jupiter.api.Assertions.*;

class SubarrayRuntimeConfigTest {

    @Test
    void builderDefaults() {
        SubarrayRuntimeConfig config = SubarrayRuntimeConfig.builder()
                .withReceptors(ReceptorMapping.identity(4))
                .build();

        assertEquals(1, config.subarrayId());
        assertEquals(SubarrayRuntimeConfig.DEFAULT_VCC_COUNT, config.vccCount());
        assertEquals(SubarrayRuntimeConfig.DEFAULT_FSP_COUNT, config.fspCount());
        assertEquals(2, config.schedulerThreads());
        assertTrue(config.modelFeed().isEmpty());
    }

    @Test
    void modelFeedIsOptional() {
        InetSocketAddress bind = new InetSocketAddress("127.0.0.1", 5600);

        SubarrayRuntimeConfig config = SubarrayRuntimeConfig.builder()
                .withReceptors(ReceptorMapping.identity(1))
                .withModelFeed(bind)
                .build();

        assertEquals(bind, config.modelFeed().orElseThrow());
    }

    @Test
    void subarrayIdMustBeInRange() {
        SubarrayRuntimeConfig.Builder builder = SubarrayRuntimeConfig.builder()
                .withReceptors(ReceptorMapping.identity(1));

        assertThrows(IllegalArgumentException.class, () -> builder.withSubarrayId(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> builder.withSubarrayId(SubarrayRuntimeConfig.MAX_SUBARRAYS + 1).build());
        assertEquals(SubarrayRuntimeConfig.MAX_SUBARRAYS,
                builder.withSubarrayId(SubarrayRuntimeConfig.MAX_SUBARRAYS).build().subarrayId());
    }

    @Test
    void receptorsMustMapInsideTheFleet() {
        ReceptorMapping mapping = ReceptorMapping.builder().addReceptor(1, 10, 1).build();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SubarrayRuntimeConfig.builder().withReceptors(mapping).withVccCount(8).build());
        assertEquals("Receptor 1 maps to VCC 10 beyond vccCount 8", e.getMessage());
    }

    @Test
    void receptorTableIsRequired() {
        assertThrows(NullPointerException.class, () -> SubarrayRuntimeConfig.builder().build());
    }

    @Test
    void countsMustBePositive() {
        SubarrayRuntimeConfig.Builder builder = SubarrayRuntimeConfig.builder()
                .withReceptors(ReceptorMapping.identity(1));

        assertThrows(IllegalArgumentException.class, () -> builder.withFspCount(0).build());
        assertThrows(IllegalArgumentException.class, () -> builder.withFspCount(4).withSchedulerThreads(0).build());
    }
}
