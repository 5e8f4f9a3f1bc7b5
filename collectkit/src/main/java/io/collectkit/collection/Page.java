/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.collection;

/**
 * One page of a {@link Collected}, as produced by {@link Collected#paginate(int, int)}.
 *
 * @param <T> the type of the items
 */
public final class Page<T> {
  private final Collected<T> items;
  private final int total;
  private final int perPage;
  private final int currentPage;
  private final int lastPage;

  Page(final Collected<T> items, final int total, final int perPage, final int currentPage,
      final int lastPage) {
    this.items = items;
    this.total = total;
    this.perPage = perPage;
    this.currentPage = currentPage;
    this.lastPage = lastPage;
  }

  /** @return the items on this page */
  public Collected<T> getItems() {
    return this.items;
  }

  /** @return the number of items across all pages */
  public int getTotal() {
    return this.total;
  }

  public int getPerPage() {
    return this.perPage;
  }

  /** @return the 1-based number of this page */
  public int getCurrentPage() {
    return this.currentPage;
  }

  /** @return the number of pages, {@code 0} for an empty collection */
  public int getLastPage() {
    return this.lastPage;
  }

  public boolean hasMorePages() {
    return this.currentPage < this.lastPage;
  }

  @Override
  public String toString() {
    return "Page [page=" + this.currentPage + "/" + this.lastPage + ", perPage=" + this.perPage
        + ", total=" + this.total + ", items=" + this.items + "]";
  }
}
