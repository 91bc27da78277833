package org.redlist.maps.reader;

import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.redlist.maps.geo.GeoUtils;
import org.redlist.maps.geo.GeometryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ContextSource} for when no Natural Earth context data is configured: draws every country of a
 * {@link BoundaryStore} that intersects the frame as land with its outline as a border.
 */
public class BoundaryStoreContext implements ContextSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(BoundaryStoreContext.class);

  private final BoundaryStore store;

  public BoundaryStoreContext(BoundaryStore store) {
    this.store = store;
  }

  @Override
  public ContextLayers layers(Envelope lonLatEnvelope) {
    List<Geometry> land = new ArrayList<>();
    List<Geometry> borders = new ArrayList<>();
    for (String code : store.codes()) {
      try {
        Geometry geometry = GeoUtils.fromWkb(store.wkb(code));
        if (geometry.getEnvelopeInternal().intersects(lonLatEnvelope)) {
          land.add(geometry);
          borders.add(geometry.getBoundary());
        }
      } catch (BoundaryStore.NotFoundException e) {
        LOGGER.debug("{} was removed from the boundary store while drawing context", code);
      } catch (GeometryException e) {
        e.log("Skipping context boundary " + code);
      }
    }
    return new ContextLayers(land, List.of(), List.of(), borders);
  }
}
