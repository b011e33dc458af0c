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

import io.wfl.autopara.domain.Arguments;
import io.wfl.autopara.domain.AutoparaException;
import io.wfl.autopara.domain.IterableArgument;
import io.wfl.autopara.domain.Operation;
import io.wfl.autopara.domain.RemoteInfo;
import io.wfl.autopara.domain.job.RemoteFunction;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Remote side of a dispatch: re-runs the whole dispatch inside the batch job, locally.
 * <p>
 * The operation's own positional and named arguments are staged unchanged, so hash-ignored
 * argument names apply to them directly. The dispatch settings travel as extra named arguments
 * under the {@value #RESERVED_PREFIX} prefix. The re-run uses {@link RemoteInfo#ignore()}, so the
 * job never submits itself again even when it sees the same profile configuration.
 * </p>
 */
public final class RemoteDispatchFunction implements RemoteFunction {
  public static final String RESERVED_PREFIX = "autopara.";

  static final String OPERATION = RESERVED_PREFIX + "operation";
  static final String ITEMS = RESERVED_PREFIX + "items";
  static final String CHUNKSIZE = RESERVED_PREFIX + "chunksize";
  static final String ITERABLE_ARGUMENT = RESERVED_PREFIX + "iterable_argument";
  static final String SKIP_FAILED = RESERVED_PREFIX + "skip_failed";

  private final Supplier<Dispatcher> dispatcher;

  public RemoteDispatchFunction() {
    this(() -> new Dispatcher(AutoparaConfig.shared()));
  }

  RemoteDispatchFunction(Supplier<Dispatcher> dispatcher) {
    this.dispatcher = dispatcher;
  }

  /**
   * Bundles a dispatch request into the arguments of this function.
   *
   * @throws IllegalArgumentException if the operation cannot be re-created by class name, or an
   *                                  operation argument uses the reserved prefix
   */
  static Arguments bundle(DispatchRequest<?> request, List<?> items) {
    var operationClass = request.operation().getClass();
    requireRecreatable(operationClass);

    Map<String, Object> named = new LinkedHashMap<>(request.arguments().named());
    named.keySet().stream().filter(k -> k.startsWith(RESERVED_PREFIX)).findFirst().ifPresent(k -> {
      throw new IllegalArgumentException("Argument name '" + k + "' uses the reserved prefix " + RESERVED_PREFIX);
    });
    named.put(OPERATION, operationClass.getName());
    named.put(ITEMS, new ArrayList<>(items));
    named.put(CHUNKSIZE, request.chunksize());
    named.put(ITERABLE_ARGUMENT, encode(request.iterableArgument()));
    named.put(SKIP_FAILED, request.skipFailed());
    return Arguments.of(request.arguments().positional(), named);
  }

  @Override
  public Object invoke(Arguments arguments) {
    Operation<Object> operation = instantiate(arguments.get(OPERATION));
    List<Object> items = arguments.get(ITEMS);
    int chunksize = ((Number) arguments.get(CHUNKSIZE)).intValue();
    Boolean skipFailed = arguments.get(SKIP_FAILED);
    String slot = arguments.get(ITERABLE_ARGUMENT);
    var operationArguments = arguments.withoutNamed(List.of(OPERATION, ITEMS, CHUNKSIZE, ITERABLE_ARGUMENT, SKIP_FAILED));

    var request = DispatchRequest.builder(items, operation)
                                 .withArguments(operationArguments)
                                 .withIterableArgument(decode(slot))
                                 .withChunksize(chunksize)
                                 .withSkipFailed(skipFailed)
                                 .withRemoteInfo(RemoteInfo.ignore())
                                 .build();
    return new ArrayList<>(dispatcher.get().dispatch(request).output().inMemory());
  }

  static void requireRecreatable(Class<?> operationClass) {
    if (operationClass.isSynthetic() || operationClass.isAnonymousClass() || operationClass.isLocalClass()
        || operationClass.getName().contains("$$Lambda")) {
      throw new IllegalArgumentException(
        "Operations dispatched remotely must be named classes, got: " + operationClass.getName());
    }
    if (operationClass.getEnclosingClass() != null && !Modifier.isStatic(operationClass.getModifiers())) {
      throw new IllegalArgumentException("Operations dispatched remotely must not be inner classes: " + operationClass.getName());
    }
    try {
      var constructor = operationClass.getDeclaredConstructor();
      if (!Modifier.isPublic(constructor.getModifiers()) || !Modifier.isPublic(operationClass.getModifiers())) {
        throw new IllegalArgumentException(
          "Operations dispatched remotely need a public class with a public no-arg constructor: " + operationClass.getName());
      }
    } catch (NoSuchMethodException e) {
      throw new IllegalArgumentException("Operations dispatched remotely need a no-arg constructor: " + operationClass.getName(), e);
    }
  }

  @SuppressWarnings("unchecked")
  private static Operation<Object> instantiate(String className) {
    try {
      var loader = Thread.currentThread().getContextClassLoader();
      var clazz = Class.forName(className, true, loader != null ? loader : RemoteDispatchFunction.class.getClassLoader());
      if (!Operation.class.isAssignableFrom(clazz)) {
        throw new AutoparaException("Class does not implement Operation: " + className);
      }
      return (Operation<Object>) clazz.getDeclaredConstructor().newInstance();
    } catch (AutoparaException e) {
      throw e;
    } catch (ReflectiveOperationException e) {
      throw new AutoparaException("Failed to instantiate operation " + className + ": " + e.getMessage(), e);
    }
  }

  static String encode(IterableArgument slot) {
    if (slot instanceof IterableArgument.Named n) {
      return "named:" + n.name();
    }
    return "positional:" + ((IterableArgument.Positional) slot).index();
  }

  static IterableArgument decode(String encoded) {
    if (encoded.startsWith("named:")) {
      return IterableArgument.named(encoded.substring("named:".length()));
    }
    if (encoded.startsWith("positional:")) {
      return IterableArgument.positional(Integer.parseInt(encoded.substring("positional:".length())));
    }
    throw new AutoparaException("Invalid iterable argument: " + encoded);
  }
}
