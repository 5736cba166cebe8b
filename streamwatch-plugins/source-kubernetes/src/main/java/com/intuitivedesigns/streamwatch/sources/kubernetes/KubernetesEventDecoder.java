/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamwatch.sources.kubernetes;

import com.intuitivedesigns.streamwatch.core.EventDecodeException;
import com.intuitivedesigns.streamwatch.core.EventDecoder;
import com.intuitivedesigns.streamwatch.core.ReceiveResult;
import com.intuitivedesigns.streamwatch.core.StreamEvent;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.Watcher;

import java.util.HashMap;
import java.util.Map;

/**
 * Wraps each watch notification in a {@link StreamEvent} keyed by {@code uid:resourceVersion}.
 * Bookmarks carry no object change and are skipped.
 */
public final class KubernetesEventDecoder<T extends HasMetadata>
        implements EventDecoder<ResourceEvent<T>, StreamEvent<T>> {

    public static final String META_ACTION = "k8s.action";
    public static final String META_KIND = "k8s.kind";
    public static final String META_NAMESPACE = "k8s.namespace";
    public static final String META_NAME = "k8s.name";

    @Override
    public ReceiveResult<StreamEvent<T>> decode(ResourceEvent<T> raw) throws EventDecodeException {
        if (raw.action() == Watcher.Action.BOOKMARK) return ReceiveResult.empty();

        T resource = raw.resource();
        ObjectMeta meta = resource.getMetadata();
        if (meta == null) {
            throw new EventDecodeException(raw.action() + " event for " + resource.getKind() + " has no metadata");
        }

        Map<String, String> md = new HashMap<>();
        md.put(META_ACTION, raw.action().name());
        putIfPresent(md, META_KIND, resource.getKind());
        putIfPresent(md, META_NAMESPACE, meta.getNamespace());
        putIfPresent(md, META_NAME, meta.getName());

        return ReceiveResult.event(new StreamEvent<>(idOf(resource, meta), resource, md));
    }

    private static String idOf(HasMetadata resource, ObjectMeta meta) {
        if (meta.getUid() != null) {
            return meta.getUid() + ":" + meta.getResourceVersion();
        }
        // Objects built client-side have no uid yet
        return resource.getKind() + "/" + meta.getNamespace() + "/" + meta.getName() + ":" + meta.getResourceVersion();
    }

    private static void putIfPresent(Map<String, String> md, String key, String value) {
        if (value != null) md.put(key, value);
    }
}
