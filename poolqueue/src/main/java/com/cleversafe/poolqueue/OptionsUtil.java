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

package com.cleversafe.poolqueue;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Primitives;

/**
 * Reflection helpers backing options classes: property-driven defaults, field-for-field copies and
 * a generic toString.
 */
final class OptionsUtil {
  private static final Logger LOGGER = LoggerFactory.getLogger(OptionsUtil.class);

  private OptionsUtil() {}

  @SuppressWarnings("unchecked")
  static <T> T populateFromProperties(final String prefix, final T object) {
    return populateFromProperties(System.getProperties(), prefix, (Class<T>) object.getClass(),
        object);
  }

  /**
   * For every public single-valued setter {@code name(x)} declared by {@code clazz}, look up
   * {@code prefix + name} in {@code properties} and, if present, invoke the setter with the parsed
   * value. Values are parsed with the parameter type's static {@code valueOf(String)}; failing
   * that, a value of the form {@code fully.qualified.Class.method} is taken to name a static no-arg
   * factory method whose result is passed instead. Unusable values are logged and skipped.
   */
  static <T> T populateFromProperties(final Properties properties, final String prefix,
      final Class<T> clazz, final T object) {
    for (final Entry<String, List<Method>> entry : setters(clazz, prefix).entrySet()) {
      final String value = properties.getProperty(entry.getKey());
      if (value == null) {
        continue;
      }
      boolean applied = false;
      for (final Method setter : entry.getValue()) {
        if (apply(object, setter, value)) {
          applied = true;
          break;
        }
      }
      if (!applied) {
        LOGGER.warn("ignoring unusable option {}={}", entry.getKey(), value);
      }
    }
    return object;
  }

  private static boolean apply(final Object target, final Method setter, final String value) {
    final Object arg;
    try {
      arg = parse(setter.getParameterTypes()[0], value);
    } catch (ReflectiveOperationException | IllegalArgumentException | SecurityException e) {
      LOGGER.debug("could not parse '{}' for {}", value, setter, e);
      return false;
    }
    try {
      setter.invoke(target, arg);
      return true;
    } catch (final InvocationTargetException e) {
      LOGGER.debug("{} rejected '{}'", setter, value, e.getCause());
      return false;
    } catch (final IllegalAccessException | IllegalArgumentException e) {
      LOGGER.debug("could not invoke {}", setter, e);
      return false;
    }
  }

  private static Object parse(final Class<?> type, final String value)
      throws ReflectiveOperationException {
    if ("null".equals(value)) {
      return null;
    }
    final Class<?> boxed = Primitives.wrap(type);
    try {
      return boxed.getMethod("valueOf", String.class).invoke(null, value);
    } catch (final NoSuchMethodException | InvocationTargetException notParseable) {
      // fall through to factory method lookup
    }
    final int methodIndex = value.lastIndexOf('.');
    if (methodIndex < 0) {
      throw new IllegalArgumentException("not a value or factory method: " + value);
    }
    final Method factory = Class.forName(value.substring(0, methodIndex))
        .getDeclaredMethod(value.substring(methodIndex + 1));
    if (!Modifier.isStatic(factory.getModifiers())) {
      throw new IllegalArgumentException("factory method must be static: " + value);
    }
    final Object made = factory.invoke(null);
    if (made != null && !boxed.isInstance(made)) {
      throw new IllegalArgumentException(value + " did not produce a " + type.getName());
    }
    return made;
  }

  private static Map<String, List<Method>> setters(final Class<?> clazz, final String prefix) {
    final Map<String, List<Method>> map = new HashMap<>();
    for (final Method m : clazz.getMethods()) {
      if (!m.getDeclaringClass().equals(clazz) || m.getParameterTypes().length != 1
          || Modifier.isStatic(m.getModifiers()) || m.isBridge()) {
        continue;
      }
      map.computeIfAbsent(prefix + m.getName(), name -> new ArrayList<>()).add(m);
    }
    return map;
  }

  static <T> void copyFields(final Class<T> clazz, final T from, final T to) {
    if (from == null || to == null) {
      return;
    }
    for (final Field f : instanceFields(clazz)) {
      try {
        f.set(to, f.get(from));
      } catch (final IllegalAccessException e) {
        throw new Error(e);
      }
    }
  }

  static String toString(final Object options) {
    final ImmutableMap.Builder<String, Object> fields = ImmutableMap.builder();
    for (final Field f : instanceFields(options.getClass())) {
      try {
        fields.put(f.getName(), String.valueOf(f.get(options)));
      } catch (final IllegalAccessException e) {
        throw new Error(e);
      }
    }
    return options.getClass().getSimpleName() + " ["
        + Joiner.on(", ").withKeyValueSeparator("=").join(fields.build()) + "]";
  }

  private static List<Field> instanceFields(final Class<?> clazz) {
    final List<Field> fields = new ArrayList<>();
    for (final Field f : clazz.getDeclaredFields()) {
      final int mods = f.getModifiers();
      if (Modifier.isFinal(mods) || Modifier.isStatic(mods)) {
        continue;
      }
      f.setAccessible(true);
      fields.add(f);
    }
    return fields;
  }
}
