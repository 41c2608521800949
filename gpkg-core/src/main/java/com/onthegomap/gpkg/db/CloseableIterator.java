package com.onthegomap.gpkg.db;

import java.io.Closeable;
import java.util.Iterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/** An iterator over rows of a query that holds a statement open until it is closed or exhausted. */
public interface CloseableIterator<T> extends Closeable, Iterator<T> {

  @Override
  void close();

  default Stream<T> stream() {
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, 0), false).onClose(this::close);
  }

  default <O> CloseableIterator<O> map(Function<T, O> mapper) {
    var parent = this;
    return new CloseableIterator<>() {
      @Override
      public void close() {
        parent.close();
      }

      @Override
      public boolean hasNext() {
        return parent.hasNext();
      }

      @Override
      public O next() {
        return mapper.apply(parent.next());
      }
    };
  }
}
