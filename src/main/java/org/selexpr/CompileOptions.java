/*
 * Copyright 2025 The Selexpr Authors
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

package org.selexpr;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import org.selexpr.position.PositionType;

/**
 * The settings that affect how selections are compiled. Instances are immutable; use {@link
 * #builder} or {@link #fromProperties}.
 */
public final class CompileOptions {

  /** The prefix of the property keys read by {@link #fromProperties}. */
  public static final String PROPERTY_PREFIX = "selexpr.";

  /** The classpath resource with the default values of all properties. */
  static final String DEFAULTS_RESOURCE = "/selexpr-defaults.properties";

  private final PositionType referencePositionType;
  private final PositionType selectionPositionType;
  private final boolean dynamicMask;
  private final boolean evaluateVelocities;
  private final boolean evaluateForces;
  private final boolean debug;

  private CompileOptions(Builder builder) {
    this.referencePositionType = builder.referencePositionType;
    this.selectionPositionType = builder.selectionPositionType;
    this.dynamicMask = builder.dynamicMask;
    this.evaluateVelocities = builder.evaluateVelocities;
    this.evaluateForces = builder.evaluateForces;
    this.debug = builder.debug;
  }

  /** Returns the options given by the defaults resource. */
  public static CompileOptions defaults() {
    return fromProperties(new Properties());
  }

  /**
   * Returns options read from {@code properties}; keys start with {@link #PROPERTY_PREFIX}, and
   * missing keys take their value from the defaults resource.
   */
  public static CompileOptions fromProperties(Properties properties) {
    Properties merged = new Properties();
    try (InputStream in = CompileOptions.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
      Preconditions.checkState(in != null, "Missing %s", DEFAULTS_RESOURCE);
      merged.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    merged.putAll(properties);
    return builder()
        .referencePositionType(PositionType.parse(get(merged, "referencePositionType")))
        .selectionPositionType(PositionType.parse(get(merged, "selectionPositionType")))
        .dynamicMask(Boolean.parseBoolean(get(merged, "dynamicMask")))
        .evaluateVelocities(Boolean.parseBoolean(get(merged, "evaluateVelocities")))
        .evaluateForces(Boolean.parseBoolean(get(merged, "evaluateForces")))
        .debug(Boolean.parseBoolean(get(merged, "debug")))
        .build();
  }

  private static String get(Properties properties, String name) {
    String value = properties.getProperty(PROPERTY_PREFIX + name);
    Preconditions.checkArgument(value != null, "No value for %s%s", PROPERTY_PREFIX, name);
    return value.trim();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .referencePositionType(referencePositionType)
        .selectionPositionType(selectionPositionType)
        .dynamicMask(dynamicMask)
        .evaluateVelocities(evaluateVelocities)
        .evaluateForces(evaluateForces)
        .debug(debug);
  }

  /** The position type for positions used as method input, when not given explicitly. */
  public PositionType referencePositionType() {
    return referencePositionType;
  }

  /** The position type of the selections' own positions, when not given explicitly. */
  public PositionType selectionPositionType() {
    return selectionPositionType;
  }

  /**
   * If true, dynamic selections keep the positions of their maximal group in every frame (with
   * the unselected ones masked out) rather than only those currently selected.
   */
  public boolean dynamicMask() {
    return dynamicMask;
  }

  public boolean evaluateVelocities() {
    return evaluateVelocities;
  }

  public boolean evaluateForces() {
    return evaluateForces;
  }

  /** If true, the compiled chain is logged at debug level after each major phase. */
  public boolean debug() {
    return debug;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("referencePositionType", referencePositionType)
        .add("selectionPositionType", selectionPositionType)
        .add("dynamicMask", dynamicMask)
        .add("evaluateVelocities", evaluateVelocities)
        .add("evaluateForces", evaluateForces)
        .add("debug", debug)
        .toString();
  }

  /** A Builder for {@link CompileOptions}; unset options have the same values as the defaults. */
  public static final class Builder {
    private PositionType referencePositionType = PositionType.ATOM;
    private PositionType selectionPositionType = PositionType.ATOM;
    private boolean dynamicMask;
    private boolean evaluateVelocities;
    private boolean evaluateForces;
    private boolean debug;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder referencePositionType(PositionType type) {
      this.referencePositionType = Preconditions.checkNotNull(type);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder selectionPositionType(PositionType type) {
      this.selectionPositionType = Preconditions.checkNotNull(type);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder dynamicMask(boolean dynamicMask) {
      this.dynamicMask = dynamicMask;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder evaluateVelocities(boolean evaluateVelocities) {
      this.evaluateVelocities = evaluateVelocities;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder evaluateForces(boolean evaluateForces) {
      this.evaluateForces = evaluateForces;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder debug(boolean debug) {
      this.debug = debug;
      return this;
    }

    public CompileOptions build() {
      return new CompileOptions(this);
    }
  }
}
