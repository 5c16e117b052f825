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
package net.hydromatic.helix.compile;

import static java.util.Objects.requireNonNull;

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.helix.ast.Core;
import net.hydromatic.helix.eval.HelixRuntimeException;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on a typed term, then
   * calls the underlying tracer.
   */
  public static Tracer withOnCore(Tracer tracer, Consumer<Core.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCore(Core.Exp e) {
        consumer.accept(e);
        super.onCore(e);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action after each reduction
   * step, then calls the underlying tracer.
   */
  public static Tracer withOnStep(
      Tracer tracer, BiConsumer<Integer, Core.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStep(int step, Core.Exp e) {
        consumer.accept(step, e);
        super.onStep(step, e);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the result of an
   * evaluation, then calls the underlying tracer.
   */
  public static Tracer withOnResult(
      Tracer tracer, Consumer<Core.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResult(Core.Exp value) {
        consumer.accept(value);
        super.onResult(value);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a type exception, then
   * calls the underlying tracer.
   */
  public static Tracer withOnTypeException(
      Tracer tracer, Consumer<TypeChecker.TypeException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean onTypeException(TypeChecker.TypeException e) {
        consumer.accept(e);
        super.onTypeException(e);
        return true;
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a runtime exception,
   * then calls the underlying tracer.
   */
  public static Tracer withOnException(
      Tracer tracer, Consumer<HelixRuntimeException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean onException(HelixRuntimeException e) {
        consumer.accept(e);
        super.onException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onCore(Core.Exp e) {}

    @Override
    public void onStep(int step, Core.Exp e) {}

    @Override
    public void onResult(Core.Exp value) {}

    @Override
    public boolean onTypeException(TypeChecker.TypeException e) {
      return false;
    }

    @Override
    public boolean onException(HelixRuntimeException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    private final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
    }

    @Override
    public void onCore(Core.Exp e) {
      tracer.onCore(e);
    }

    @Override
    public void onStep(int step, Core.Exp e) {
      tracer.onStep(step, e);
    }

    @Override
    public void onResult(Core.Exp value) {
      tracer.onResult(value);
    }

    @Override
    public boolean onTypeException(TypeChecker.TypeException e) {
      return tracer.onTypeException(e);
    }

    @Override
    public boolean onException(HelixRuntimeException e) {
      return tracer.onException(e);
    }
  }
}

// End Tracers.java
