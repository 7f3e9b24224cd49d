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
package net.hydromatic.boxer.batch;

import static java.util.Objects.requireNonNull;

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.boxer.ast.Drt;
import net.hydromatic.boxer.parse.BoxerParseException;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each located block,
   * then calls the underlying tracer. */
  public static Tracer withOnBlock(Tracer tracer,
      Consumer<TermBlock> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onBlock(TermBlock block) {
        consumer.accept(block);
        super.onBlock(block);
      }
    };
  }

  /** Returns a tracer that performs the given action on each result,
   * then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer,
      BiConsumer<String, Drt.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(String discourseId, Drt.Exp exp) {
        consumer.accept(discourseId, exp);
        super.onResult(discourseId, exp);
      }
    };
  }

  /** Returns a tracer that performs the given action on each parse
   * exception, then calls the underlying tracer. */
  public static Tracer withOnException(Tracer tracer,
      BiConsumer<String, BoxerParseException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onException(String discourseId,
          BoxerParseException e) {
        consumer.accept(discourseId, e);
        super.onException(discourseId, e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onBlock(TermBlock block) {
    }

    @Override public void onResult(String discourseId, Drt.Exp exp) {
    }

    @Override public void onException(String discourseId,
        BoxerParseException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    private final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override public void onBlock(TermBlock block) {
      tracer.onBlock(block);
    }

    @Override public void onResult(String discourseId, Drt.Exp exp) {
      tracer.onResult(discourseId, exp);
    }

    @Override public void onException(String discourseId,
        BoxerParseException e) {
      tracer.onException(discourseId, e);
    }
  }
}

// End Tracers.java
