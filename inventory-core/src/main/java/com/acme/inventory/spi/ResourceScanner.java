package com.acme.inventory.spi;

import com.acme.inventory.model.ResourceDetail;
import com.acme.inventory.model.ResourceItem;
import com.acme.inventory.model.ResourcePage;

/**
 * Account-bound listing and detail access for one resource type. {@link #getDetail} may be called
 * from several threads at once.
 */
public interface ResourceScanner extends AutoCloseable {

  /**
   * Fetches one listing page.
   *
   * @param cursor null for the first page, otherwise the previous page's {@code nextCursor}
   */
  ResourcePage listPage(String cursor);

  ResourceDetail getDetail(ResourceItem item);

  @Override
  default void close() {}
}
