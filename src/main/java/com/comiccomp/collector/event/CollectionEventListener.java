package com.comiccomp.collector.event;

/**
 * Consumer of pipeline events (log shipping, alert routing, dashboards).
 * Implementations are invoked off the collection threads.
 */
@FunctionalInterface
public interface CollectionEventListener {

    void onEvent(CollectionEvent event);
}
