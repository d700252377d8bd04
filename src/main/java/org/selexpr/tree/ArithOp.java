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

package org.selexpr.tree;

/** Arithmetic operators; all operate on reals. */
public enum ArithOp {
  PLUS("+") {
    @Override
    public double apply(double left, double right) {
      return left + right;
    }
  },
  MINUS("-") {
    @Override
    public double apply(double left, double right) {
      return left - right;
    }
  },
  MULTIPLY("*") {
    @Override
    public double apply(double left, double right) {
      return left * right;
    }
  },
  DIVIDE("/") {
    @Override
    public double apply(double left, double right) {
      return left / right;
    }
  },
  EXPONENT("^") {
    @Override
    public double apply(double left, double right) {
      return Math.pow(left, right);
    }
  },
  /** Unary minus; the right operand is ignored. */
  NEGATE("-") {
    @Override
    public double apply(double left, double right) {
      return -left;
    }

    @Override
    public int arity() {
      return 1;
    }
  };

  public final String symbol;

  ArithOp(String symbol) {
    this.symbol = symbol;
  }

  public abstract double apply(double left, double right);

  public int arity() {
    return 2;
  }
}
