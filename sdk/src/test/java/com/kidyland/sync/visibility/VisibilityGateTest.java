// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.visibility;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class VisibilityGateTest {

    @Test
    void dispatchesHiddenAndVisibleCallbacks() {
        var source = new SimpleVisibilitySource();
        List<String> events = new ArrayList<>();
        new VisibilityGate(source).onHidden(() -> events.add("hidden")).onVisible(() -> events.add("visible"));

        source.setVisible(false);
        source.setVisible(false);
        source.setVisible(true);

        assertEquals(List.of("hidden", "visible"), events);
    }

    @Test
    void registersSingleListener() {
        var source = mock(VisibilitySource.class);

        var gate = new VisibilityGate(source).onHidden(() -> {}).onVisible(() -> {});

        assertTrue(gate.isAttached());
        verify(source, times(1)).addVisibilityListener(any());
    }

    @Test
    void detachIsIdempotentAndSilencesCallbacks() {
        var source = new SimpleVisibilitySource();
        List<String> events = new ArrayList<>();
        var gate = new VisibilityGate(source).onHidden(() -> events.add("hidden"));

        gate.detach();
        gate.detach();
        source.setVisible(false);

        assertFalse(gate.isAttached());
        assertEquals(0, source.getListenerCount());
        assertTrue(events.isEmpty());
    }

    @Test
    void reportsSourceState() {
        var source = new SimpleVisibilitySource(false);

        assertFalse(new VisibilityGate(source).isVisible());
        assertTrue(new VisibilityGate(VisibilitySource.alwaysVisible()).isVisible());
    }
}
