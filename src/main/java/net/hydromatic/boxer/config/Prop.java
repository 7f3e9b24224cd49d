/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.boxer.config;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Ints;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls how Boxer output is read.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that has no
 * entry in the map has its default value.
 */
public enum Prop {
  /**
   * Boolean property "occurrenceIndex" controls whether predicate names
   * contain the sentence and word position of their word, for example
   * {@code n_dog_s0_w1_1} rather than {@code n_dog_1}. Default is false.
   */
  OCCURRENCE_INDEX("occurrenceIndex", Boolean.class, false),

  /**
   * Integer property "semLineOffset" is the number of lines between an
   * {@code id(...)} line and the {@code sem(...)} header of the same
   * discourse. Default is 4.
   */
  SEM_LINE_OFFSET("semLineOffset", Integer.class, 4),

  /**
   * Integer property "termLineOffset" is the number of lines between an
   * {@code id(...)} line and the line that holds the discourse's DRS term.
   * Default is 8.
   */
  TERM_LINE_OFFSET("termLineOffset", Integer.class, 8),

  /**
   * Boolean property "parallel" controls whether the discourses of a batch
   * are parsed in parallel. The result is the same either way. Default is
   * false.
   */
  PARALLEL("parallel", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /**
   * Reads properties, such as those of a {@code boxer.properties} file, into
   * a new map. Keys may be camel-case ("termLineOffset") or upper-case
   * ("TERM_LINE_OFFSET"); unknown keys are an error.
   */
  public static Map<Prop, Object> load(Properties properties) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    for (String key : properties.stringPropertyNames()) {
      lookup(key).setLenient(map, properties.getProperty(key));
    }
    return map;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    Object o = map.get(this);
    return this.<Integer>typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    return (T) (o == null ? defaultValue : o);
  }

  /** Sets the value of a property, allowing strings for boolean and integer
   * types. */
  public void setLenient(Map<Prop, Object> map, Object value) {
    if (value instanceof String) {
      final String s = ((String) value).trim();
      if (type == Boolean.class) {
        switch (s.toLowerCase(Locale.ROOT)) {
        case "true":
          set(map, true);
          return;
        case "false":
          set(map, false);
          return;
        default:
          throw new IllegalArgumentException("value for property "
              + camelName + " must be 'true' or 'false'");
        }
      }
      if (type == Integer.class) {
        final @Nullable Integer i = Ints.tryParse(s);
        if (i == null) {
          throw new IllegalArgumentException("value for property "
              + camelName + " must be an integer");
        }
        set(map, i);
        return;
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, Object value) {
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException("value for property "
          + camelName + " must have type " + type);
    }
    map.put(this, value);
  }
}

// End Prop.java
