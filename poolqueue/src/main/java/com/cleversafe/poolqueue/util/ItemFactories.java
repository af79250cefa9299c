/*
 * Copyright (C) 2011 the original author or authors. See the notice.md file distributed with this
 * work for additional information regarding copyright ownership.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.cleversafe.poolqueue.util;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import com.google.common.base.Throwables;
import com.google.common.primitives.Primitives;

public final class ItemFactories {
  private ItemFactories() {}

  /**
   * Returns a {@link Supplier} which constructs a new instance of {@code type} on every call,
   * passing {@code args} to the public constructor whose parameters accept them. The constructor is
   * resolved once, here; a primitive parameter accepts its boxed argument and a {@code null}
   * argument matches any reference parameter. When several constructors accept the arguments the
   * most specific one is used.
   *
   * @throws IllegalArgumentException if {@code type} is abstract, or no public constructor accepts
   *         the arguments, or no single accepting constructor is most specific
   */
  public static <T> Supplier<T> constructing(final Class<T> type, final Object... args) {
    Objects.requireNonNull(type, "item type cannot be null");
    final Object[] ctorArgs = args.clone();
    final Constructor<T> ctor = findConstructor(type, ctorArgs);
    return () -> {
      try {
        return ctor.newInstance(ctorArgs);
      } catch (final InvocationTargetException e) {
        Throwables.throwIfUnchecked(e.getCause());
        throw new IllegalStateException("failed to construct " + type.getName(), e.getCause());
      } catch (final InstantiationException | IllegalAccessException e) {
        throw new IllegalStateException("failed to construct " + type.getName(), e);
      }
    };
  }

  /**
   * Picks the accepting constructor whose parameters are each assignable to those of every other
   * accepting constructor, as overload resolution would. Ties are rejected rather than broken by
   * reflection order.
   */
  @SuppressWarnings("unchecked")
  private static <T> Constructor<T> findConstructor(final Class<T> type, final Object[] args) {
    if (Modifier.isAbstract(type.getModifiers())) {
      throw new IllegalArgumentException("cannot construct abstract type " + type.getName());
    }
    final List<Constructor<?>> accepting = new ArrayList<>();
    for (final Constructor<?> candidate : type.getConstructors()) {
      if (accepts(candidate.getParameterTypes(), args)) {
        accepting.add(candidate);
      }
    }
    if (accepting.isEmpty()) {
      throw new IllegalArgumentException("no public constructor of " + type.getName()
          + " accepts arguments " + Arrays.toString(args));
    }
    Constructor<?> chosen = null;
    for (final Constructor<?> candidate : accepting) {
      boolean mostSpecific = true;
      for (final Constructor<?> other : accepting) {
        if (other != candidate
            && !assignable(candidate.getParameterTypes(), other.getParameterTypes())) {
          mostSpecific = false;
          break;
        }
      }
      if (mostSpecific) {
        if (chosen != null) {
          throw ambiguous(type, args, accepting);
        }
        chosen = candidate;
      }
    }
    if (chosen == null) {
      throw ambiguous(type, args, accepting);
    }
    return (Constructor<T>) chosen;
  }

  private static IllegalArgumentException ambiguous(final Class<?> type, final Object[] args,
      final List<Constructor<?>> accepting) {
    return new IllegalArgumentException("arguments " + Arrays.toString(args)
        + " match several constructors of " + type.getName() + ": " + accepting);
  }

  private static boolean assignable(final Class<?>[] from, final Class<?>[] to) {
    for (int i = 0; i < from.length; i++) {
      if (!Primitives.wrap(to[i]).isAssignableFrom(Primitives.wrap(from[i]))) {
        return false;
      }
    }
    return true;
  }

  private static boolean accepts(final Class<?>[] params, final Object[] args) {
    if (params.length != args.length) {
      return false;
    }
    for (int i = 0; i < params.length; i++) {
      if (args[i] == null) {
        if (params[i].isPrimitive()) {
          return false;
        }
      } else if (!Primitives.wrap(params[i]).isInstance(args[i])) {
        return false;
      }
    }
    return true;
  }
}
