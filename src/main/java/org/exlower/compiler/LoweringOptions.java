/*
 * Copyright 2025 The Exlower Authors
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


package org.exlower.compiler;

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import org.jspecify.annotations.Nullable;

/**
 * Feature toggles and limits for one lowering. Instances are immutable; use {@link #builder} or
 * {@link #fromProperties} to create one.
 *
 * <p>The recognized properties are:
 *
 * <ul>
 *   <li>{@code exlower.loopIntents} (boolean, default true): replace recognized imperative loops
 *       with declarative ones; if false every loop is lowered structurally.
 *   <li>{@code exlower.comprehensions} (boolean, default true): recognize the filter/map
 *       accumulation idiom and emit a {@code for} comprehension.
 *   <li>{@code exlower.unrolledLists} (boolean, default true): collapse a sequence of appends to an
 *       empty list into a list literal.
 *   <li>{@code exlower.threadLoopState} (boolean, default true): thread variables that a loop body
 *       rebinds through {@code Enum.reduce}; if false they are left to {@code Enum.each}, and the
 *       rebindings do not survive the loop.
 *   <li>{@code exlower.unusedStyle} ({@code prefix} or {@code wildcard}, default prefix): how to
 *       mark pattern variables that are never referenced.
 *   <li>{@code exlower.maxNodeVisits} (int, default 1000000): the node-visit ceiling.
 * </ul>
 */
public final class LoweringOptions {

  /** How a binding that is never referenced appears in a pattern. */
  public enum UnusedStyle {
    /** {@code _name} if the binding has a user-visible name, otherwise {@code _}. */
    PREFIX,
    /** Always {@code _}. */
    WILDCARD
  }

  public static final String PREFIX = "exlower.";

  public static final LoweringOptions DEFAULT = builder().build();

  public final boolean loopIntents;
  public final boolean comprehensions;
  public final boolean unrolledLists;
  public final boolean threadLoopState;
  public final UnusedStyle unusedStyle;
  public final int maxNodeVisits;

  private LoweringOptions(Builder builder) {
    this.loopIntents = builder.loopIntents;
    this.comprehensions = builder.comprehensions;
    this.unrolledLists = builder.unrolledLists;
    this.threadLoopState = builder.threadLoopState;
    this.unusedStyle = builder.unusedStyle;
    this.maxNodeVisits = builder.maxNodeVisits;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a Builder initialized from this instance. */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.loopIntents = loopIntents;
    builder.comprehensions = comprehensions;
    builder.unrolledLists = unrolledLists;
    builder.threadLoopState = threadLoopState;
    builder.unusedStyle = unusedStyle;
    builder.maxNodeVisits = maxNodeVisits;
    return builder;
  }

  /**
   * Returns options with each property that is present in {@code properties} overriding the
   * default. Throws an IllegalArgumentException if a property has an unparseable value.
   */
  public static LoweringOptions fromProperties(Properties properties) {
    Builder builder = builder();
    builder.loopIntents = getBoolean(properties, "loopIntents", builder.loopIntents);
    builder.comprehensions = getBoolean(properties, "comprehensions", builder.comprehensions);
    builder.unrolledLists = getBoolean(properties, "unrolledLists", builder.unrolledLists);
    builder.threadLoopState = getBoolean(properties, "threadLoopState", builder.threadLoopState);
    String style = properties.getProperty(PREFIX + "unusedStyle");
    if (style != null) {
      try {
        builder.unusedStyle = UnusedStyle.valueOf(Ascii.toUpperCase(style.trim()));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(
            String.format("Bad value for %sunusedStyle: '%s'", PREFIX, style), e);
      }
    }
    String maxVisits = properties.getProperty(PREFIX + "maxNodeVisits");
    if (maxVisits != null) {
      try {
        builder.setMaxNodeVisits(Integer.parseInt(maxVisits.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            String.format("Bad value for %smaxNodeVisits: '%s'", PREFIX, maxVisits), e);
      }
    }
    return builder.build();
  }

  /** Reads a properties file from the classpath and calls {@link #fromProperties}. */
  public static LoweringOptions load(String resource) {
    Properties properties = new Properties();
    try (InputStream in = LoweringOptions.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No such resource: " + resource);
      }
      properties.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Can't read " + resource, e);
    }
    return fromProperties(properties);
  }

  private static boolean getBoolean(Properties properties, String key, boolean defaultValue) {
    @Nullable String value = properties.getProperty(PREFIX + key);
    if (value == null) {
      return defaultValue;
    }
    value = Ascii.toLowerCase(value.trim());
    Preconditions.checkArgument(
        value.equals("true") || value.equals("false"),
        "Bad value for %s%s: '%s'",
        PREFIX,
        key,
        value);
    return value.equals("true");
  }

  @Override
  public String toString() {
    return String.format(
        "loopIntents=%s comprehensions=%s unrolledLists=%s threadLoopState=%s unusedStyle=%s"
            + " maxNodeVisits=%s",
        loopIntents, comprehensions, unrolledLists, threadLoopState, unusedStyle, maxNodeVisits);
  }

  /** Builds a LoweringOptions; every option starts at its default. */
  public static final class Builder {
    private boolean loopIntents = true;
    private boolean comprehensions = true;
    private boolean unrolledLists = true;
    private boolean threadLoopState = true;
    private UnusedStyle unusedStyle = UnusedStyle.PREFIX;
    private int maxNodeVisits = 1_000_000;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setLoopIntents(boolean loopIntents) {
      this.loopIntents = loopIntents;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setComprehensions(boolean comprehensions) {
      this.comprehensions = comprehensions;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setUnrolledLists(boolean unrolledLists) {
      this.unrolledLists = unrolledLists;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setThreadLoopState(boolean threadLoopState) {
      this.threadLoopState = threadLoopState;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setUnusedStyle(UnusedStyle unusedStyle) {
      this.unusedStyle = Preconditions.checkNotNull(unusedStyle);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMaxNodeVisits(int maxNodeVisits) {
      Preconditions.checkArgument(maxNodeVisits > 0, "maxNodeVisits must be positive");
      this.maxNodeVisits = maxNodeVisits;
      return this;
    }

    public LoweringOptions build() {
      return new LoweringOptions(this);
    }
  }
}
