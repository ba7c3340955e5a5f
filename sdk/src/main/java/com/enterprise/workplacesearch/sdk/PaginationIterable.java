/*
 * Copyright © 2017 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.enterprise.workplacesearch.sdk;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * {@link Iterable} over a paginated listing where each page carries an optional continuation
 * token.
 *
 * <p>Pages are fetched lazily. A failure while fetching a page surfaces from the iterator as an
 * {@link UncheckedIOException}; {@link #toList()} unwraps it so callers see the original
 * {@link IOException}.
 */
public abstract class PaginationIterable<T, Q> implements Iterable<T> {

  private final Optional<Q> startPage;

  /** Items of one page and the optional token of the next one. */
  public static class Page<T, Q> {
    private final List<T> results;
    private final Optional<Q> nextPageToken;

    public Page(List<T> results, Optional<Q> nextPageToken) {
      this.results = checkNotNull(results);
      this.nextPageToken = checkNotNull(nextPageToken);
    }

    public List<T> getResults() {
      return results;
    }

    public Optional<Q> getNextPageToken() {
      return nextPageToken;
    }
  }

  public PaginationIterable(Optional<Q> startPage) {
    this.startPage = checkNotNull(startPage);
  }

  /**
   * Returns the page identified by {@code nextPage}, or the first page when empty.
   *
   * @throws IOException if fetching the page fails
   */
  public abstract Page<T, Q> getPage(Optional<Q> nextPage) throws IOException;

  @Override
  public Iterator<T> iterator() {
    Iterable<List<T>> pages = PageIterator::new;
    return Iterables.concat(pages).iterator();
  }

  /**
   * Fetches every page and returns all items in listing order.
   *
   * @throws IOException if fetching any page fails
   */
  public List<T> toList() throws IOException {
    try {
      return ImmutableList.copyOf(this);
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  private class PageIterator implements Iterator<List<T>> {
    private Page<T, Q> current = new Page<>(Collections.emptyList(), startPage);
    private boolean firstPageLoaded;

    @Override
    public boolean hasNext() {
      while (current.results.isEmpty()
          && (current.nextPageToken.isPresent() || !firstPageLoaded)) {
        try {
          current = checkNotNull(getPage(current.nextPageToken));
        } catch (IOException e) {
          throw new UncheckedIOException("Error fetching page", e);
        }
        firstPageLoaded = true;
      }
      return !current.results.isEmpty();
    }

    @Override
    public List<T> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      List<T> results = current.results;
      current = new Page<>(Collections.emptyList(), current.nextPageToken);
      return results;
    }
  }
}
