package org.redlist.maps.assessment;

import java.io.IOException;
import org.redlist.maps.compute.ComputeService;
import org.redlist.maps.compute.ComputeServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utilities for asset folders on the compute service.
 */
public class AssetFolders {

  private static final Logger LOGGER = LoggerFactory.getLogger(AssetFolders.class);

  private AssetFolders() {}

  /**
   * Creates the folder {@code path} unless it exists already.
   *
   * @return true if the folder was created, false if it already existed
   */
  public static boolean ensureExists(ComputeService service, String path) throws IOException, InterruptedException {
    if (service.getAsset(path).isPresent()) {
      LOGGER.debug("Asset folder {} already exists", path);
      return false;
    }
    try {
      service.createFolder(path);
      return true;
    } catch (ComputeServiceException e) {
      if (e.isAlreadyExists()) {
        LOGGER.debug("Asset folder {} was created concurrently", path);
        return false;
      }
      throw e;
    }
  }
}
