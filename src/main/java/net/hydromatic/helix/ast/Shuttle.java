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
package net.hydromatic.helix.ast;

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import net.hydromatic.helix.type.RecordType;

/** Visits and transforms Core expression trees.
 *
 * <p>The default implementation of each {@code visit} method visits the
 * node's children and returns a copy if any child changed. */
public class Shuttle {
  protected Core.Exp visit(Core.Id id) {
    return id; // leaf
  }

  protected Core.Exp visit(Core.Literal literal) {
    return literal; // leaf
  }

  protected Core.Exp visit(Core.Fn fn) {
    return fn.copy(fn.body.accept(this));
  }

  protected Core.Exp visit(Core.Apply apply) {
    return apply.copy(apply.fn.accept(this), apply.arg.accept(this));
  }

  protected Core.Exp visit(Core.Let let) {
    return let.copy(let.exp.accept(this), let.body.accept(this));
  }

  protected Core.Exp visit(Core.FuzzyLet fuzzyLet) {
    return fuzzyLet.copy(fuzzyLet.exp.accept(this),
        fuzzyLet.body.accept(this));
  }

  protected Core.Exp visit(Core.If anIf) {
    return anIf.copy(anIf.condition.accept(this), anIf.ifTrue.accept(this),
        anIf.ifFalse.accept(this));
  }

  protected Core.Exp visit(Core.Record record) {
    final ImmutableSortedMap.Builder<String, Core.Exp> args =
        ImmutableSortedMap.orderedBy(RecordType.ORDERING);
    for (Map.Entry<String, Core.Exp> e : record.args.entrySet()) {
      args.put(e.getKey(), e.getValue().accept(this));
    }
    return record.copy(args.build());
  }

  protected Core.Exp visit(Core.Select select) {
    return select.copy(select.exp.accept(this));
  }

  protected Core.Exp visit(Core.Wrap wrap) {
    return wrap.copy(wrap.value.accept(this), wrap.confidence.accept(this));
  }
}

// End Shuttle.java
