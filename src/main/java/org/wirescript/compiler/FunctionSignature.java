/*
 * Copyright 2025 The Retrospect Authors
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

package org.wirescript.compiler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import org.wirescript.graph.PortType;

/**
 * The externally visible shape of a function: its name, ordered parameters, access and flags.
 * Signatures are what skeleton-only compiles produce, and what overrides are checked against.
 */
public final class FunctionSignature {

  public enum Access {
    PUBLIC,
    PROTECTED,
    PRIVATE
  }

  public enum Flag {
    /** May be overridden by a subclass. */
    OVERRIDABLE,
    /** May not be overridden even if the parent allowed it. */
    FINAL,
    PURE,
    CONST,
    /** Implemented by an event in the event graph. */
    EVENT,
    /** The consolidated event graph itself. */
    EVENT_GRAPH,
    /** Only a signature; has no body. */
    DELEGATE,
    NET,
    NET_MULTICAST,
    NET_SERVER,
    NET_CLIENT,
    NET_RELIABLE;

    /** The flags that describe network replication. */
    public static final ImmutableList<Flag> NET_FLAGS =
        ImmutableList.of(NET, NET_MULTICAST, NET_SERVER, NET_CLIENT, NET_RELIABLE);
  }

  /**
   * One parameter. The name is the parameter's identity: overrides are matched to their parent's
   * parameters by name.
   */
  public record Param(String name, PortType type, boolean isOutput) {
    public static Param in(String name, PortType type) {
      return new Param(name, type, false);
    }

    public static Param out(String name, PortType type) {
      return new Param(name, type, true);
    }

    @Override
    public String toString() {
      return (isOutput ? "out " : "") + name + ": " + type;
    }
  }

  public final String name;
  public final ImmutableList<Param> params;
  public final Access access;
  public final Set<Flag> flags;

  public FunctionSignature(
      String name, Collection<Param> params, Access access, Collection<Flag> flags) {
    this.name = name;
    this.params = ImmutableList.copyOf(params);
    this.access = access;
    this.flags = Sets.immutableEnumSet(flags);
  }

  /** Returns a public signature with no flags. */
  public static FunctionSignature of(String name, Param... params) {
    return new FunctionSignature(
        name, ImmutableList.copyOf(params), Access.PUBLIC, EnumSet.noneOf(Flag.class));
  }

  /** Returns a copy of this signature with the given flags added. */
  public FunctionSignature withFlags(Flag... added) {
    EnumSet<Flag> newFlags = EnumSet.noneOf(Flag.class);
    newFlags.addAll(flags);
    newFlags.addAll(ImmutableList.copyOf(added));
    return new FunctionSignature(name, params, access, newFlags);
  }

  public FunctionSignature withAccess(Access newAccess) {
    return new FunctionSignature(name, params, newAccess, flags);
  }

  public boolean hasFlag(Flag flag) {
    return flags.contains(flag);
  }

  public boolean isOverridable() {
    return flags.contains(Flag.OVERRIDABLE) && !flags.contains(Flag.FINAL);
  }

  public boolean isEvent() {
    return flags.contains(Flag.EVENT);
  }

  public ImmutableList<Param> inputs() {
    return params.stream().filter(p -> !p.isOutput()).collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Param> outputs() {
    return params.stream().filter(Param::isOutput).collect(ImmutableList.toImmutableList());
  }

  /** Returns the subset of this signature's flags that describe network replication. */
  public EnumSet<Flag> netFlags() {
    EnumSet<Flag> result = EnumSet.noneOf(Flag.class);
    for (Flag f : Flag.NET_FLAGS) {
      if (flags.contains(f)) {
        result.add(f);
      }
    }
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof FunctionSignature other
        && name.equals(other.name)
        && params.equals(other.params)
        && access == other.access
        && flags.equals(other.flags);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, params, access, flags);
  }

  @Override
  public String toString() {
    return name + params;
  }
}
