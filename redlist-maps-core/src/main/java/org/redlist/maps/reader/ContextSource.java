package org.redlist.maps.reader;

import org.locationtech.jts.geom.Envelope;

/**
 * Provides the {@link ContextLayers} visible within a lon/lat envelope.
 */
@FunctionalInterface
public interface ContextSource {

  /** A source with nothing to draw. */
  ContextSource NONE = envelope -> ContextLayers.EMPTY;

  ContextLayers layers(Envelope lonLatEnvelope);
}
