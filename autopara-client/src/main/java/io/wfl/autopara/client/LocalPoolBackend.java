/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
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
package io.wfl.autopara.client;

import com.google.common.collect.Iterators;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.wfl.autopara.domain.Arguments;
import io.wfl.autopara.domain.AutoparaException;
import io.wfl.autopara.domain.IterableArgument;
import io.wfl.autopara.domain.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Runs an operation over chunks of an iterable on a fixed pool of worker threads, or serially on
 * the calling thread when the pool size is 0.
 *
 * <h2>Ordering</h2>
 * <p>
 * Chunks are submitted in input order and their outputs are handed to the consumer in the same
 * order, whatever order the workers finish in. At most {@code 2 * npool} chunks are in flight, so
 * unbounded iterables stream through without being materialized.
 * </p>
 *
 * <h2>Failed results</h2>
 * <p>
 * A {@code null} chunk result means "no result" for every item of the chunk, and a {@code null}
 * element means "no result" for that item. With {@code skipFailed} these are dropped; otherwise
 * they are passed on as {@code null}.
 * </p>
 *
 * <h2>Initializer</h2>
 * <p>
 * The initializer runs once on each worker thread before its first chunk, or once on the calling
 * thread in serial mode.
 * </p>
 *
 * <h2>Errors</h2>
 * <p>
 * An exception thrown by the operation or the initializer cancels the chunks still in flight and
 * is rethrown as {@link AutoparaException}.
 * </p>
 */
final class LocalPoolBackend {
  private static final Logger logger = LoggerFactory.getLogger(LocalPoolBackend.class);

  <O> void execute(DispatchRequest<O> request, int npool, Consumer<? super O> consumer) {
    var chunks = Iterators.partition(request.iterable().iterator(), request.chunksize());
    var task = new ChunkTask<>(request.operation(), request.arguments(), request.iterableArgument());
    var initializer = request.initializer().orElse(null);

    if (npool == 0) {
      logger.debug("Running {} serially", request.operation());
      if (initializer != null) {
        initializer.run();
      }
      while (chunks.hasNext()) {
        var chunk = chunks.next();
        emit(chunk.size(), invoke(task, chunk), request.skipFailed(), consumer);
      }
      return;
    }

    logger.debug("Running {} on {} worker threads", request.operation(), npool);
    var initialized = ThreadLocal.withInitial(() -> Boolean.FALSE);
    var factory = new ThreadFactoryBuilder().setNameFormat("autopara-pool-%d").setDaemon(true).build();
    ExecutorService executor = Executors.newFixedThreadPool(npool, factory);
    Deque<InFlight<O>> inFlight = new ArrayDeque<>();
    try {
      while (chunks.hasNext()) {
        var chunk = chunks.next();
        inFlight.addLast(new InFlight<>(chunk.size(), executor.submit(() -> {
          if (initializer != null && !initialized.get()) {
            initializer.run();
            initialized.set(Boolean.TRUE);
          }
          return task.apply(chunk);
        })));
        if (inFlight.size() >= 2 * npool) {
          drainOne(inFlight, request.skipFailed(), consumer);
        }
      }
      while (!inFlight.isEmpty()) {
        drainOne(inFlight, request.skipFailed(), consumer);
      }
    } finally {
      inFlight.forEach(f -> f.future().cancel(true));
      executor.shutdownNow();
    }
  }

  private static <O> List<O> invoke(ChunkTask<O> task, List<?> chunk) {
    try {
      return task.apply(chunk);
    } catch (RuntimeException e) {
      throw new AutoparaException("Operation failed on a chunk of " + chunk.size() + " items: " + e.getMessage(), e);
    }
  }

  private static <O> void drainOne(Deque<InFlight<O>> inFlight, boolean skipFailed, Consumer<? super O> consumer) {
    var head = inFlight.removeFirst();
    List<O> result;
    try {
      result = head.future().get();
    } catch (ExecutionException e) {
      var cause = e.getCause();
      throw new AutoparaException("Operation failed on a chunk of " + head.size() + " items: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AutoparaException("Interrupted while waiting for chunk results", e);
    }
    emit(head.size(), result, skipFailed, consumer);
  }

  private static <O> void emit(int chunkSize, List<O> result, boolean skipFailed, Consumer<? super O> consumer) {
    if (result == null) {
      if (!skipFailed) {
        Collections.<O>nCopies(chunkSize, null).forEach(consumer);
      }
      return;
    }
    for (var item : result) {
      if (item != null || !skipFailed) {
        consumer.accept(item);
      }
    }
  }

  private record InFlight<O>(int size, Future<List<O>> future) {}

  /**
   * Places a chunk in the operation's arguments and applies it.
   */
  private record ChunkTask<O>(Operation<O> operation, Arguments arguments, IterableArgument slot) {
    List<O> apply(List<?> chunk) {
      return operation.apply(arguments.withChunk(slot, new ArrayList<>(chunk)));
    }
  }
}
