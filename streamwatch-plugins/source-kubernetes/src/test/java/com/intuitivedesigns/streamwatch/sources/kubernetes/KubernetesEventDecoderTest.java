/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.kubernetes;

import com.intuitivedesigns.streamwatch.core.EventDecodeException;
import com.intuitivedesigns.streamwatch.core.ReceiveResult;
import com.intuitivedesigns.streamwatch.core.StreamEvent;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.Watcher;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KubernetesEventDecoderTest {

    private final KubernetesEventDecoder<Pod> decoder = new KubernetesEventDecoder<>();

    @Test
    void decodesIdAndMetadata() throws Exception {
        Pod pod = new PodBuilder()
                .withNewMetadata()
                .withUid("7c1f")
                .withResourceVersion("4711")
                .withNamespace("jobs")
                .withName("worker-1")
                .endMetadata()
                .build();

        ReceiveResult<StreamEvent<Pod>> result = decoder.decode(new ResourceEvent<>(Watcher.Action.DELETED, pod));

        StreamEvent<Pod> event = result.value();
        assertEquals("7c1f:4711", event.id());
        assertSame(pod, event.data());
        assertEquals("DELETED", event.metadata().get(KubernetesEventDecoder.META_ACTION));
        assertEquals("Pod", event.metadata().get(KubernetesEventDecoder.META_KIND));
        assertEquals("jobs", event.metadata().get(KubernetesEventDecoder.META_NAMESPACE));
        assertEquals("worker-1", event.metadata().get(KubernetesEventDecoder.META_NAME));
    }

    @Test
    void bookmarksAreSkipped() throws Exception {
        Pod pod = new PodBuilder().withNewMetadata().withResourceVersion("9").endMetadata().build();
        assertTrue(decoder.decode(new ResourceEvent<>(Watcher.Action.BOOKMARK, pod)).isEmpty());
    }

    @Test
    void missingMetadataIsADecodeError() {
        Pod pod = new Pod();
        assertThrows(EventDecodeException.class,
                () -> decoder.decode(new ResourceEvent<>(Watcher.Action.ADDED, pod)));
    }
}
