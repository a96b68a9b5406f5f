/*
 *    Copyright 2009-2021 the original author or authors.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */
package org.mathparse.mathml.ast;

import java.util.List;
import java.util.Objects;

/**
 * Epsilon based comparison of numbers and math trees.
 * <p>
 * Floating point components ({@link NumType.Real}, both parts of the complex kinds, the mantissa of
 * {@link NumType.ENotation}) match when their absolute difference is at most epsilon. Integers, rationals,
 * constants and the e-notation exponent must match exactly.
 */
public final class TolerantEquality {

  public static final double DEFAULT_EPSILON = 1e-9;

  private TolerantEquality() {
    // Prevent Instantiation
  }

  public static boolean approximatelyEqual(double a, double b, double epsilon) {
    if (Double.compare(a, b) == 0) {
      // covers NaN == NaN and equal infinities
      return true;
    }
    return Math.abs(a - b) <= epsilon;
  }

  public static boolean approximatelyEqual(NumType a, NumType b) {
    return approximatelyEqual(a, b, DEFAULT_EPSILON);
  }

  public static boolean approximatelyEqual(NumType a, NumType b, double epsilon) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null || a.getKind() != b.getKind()) {
      return false;
    }
    switch (a.getKind()) {
      case REAL:
        return approximatelyEqual(((NumType.Real) a).getValue(), ((NumType.Real) b).getValue(), epsilon);
      case COMPLEX_CARTESIAN: {
        NumType.ComplexCartesian x = (NumType.ComplexCartesian) a;
        NumType.ComplexCartesian y = (NumType.ComplexCartesian) b;
        return approximatelyEqual(x.getReal(), y.getReal(), epsilon)
            && approximatelyEqual(x.getImaginary(), y.getImaginary(), epsilon);
      }
      case COMPLEX_POLAR: {
        NumType.ComplexPolar x = (NumType.ComplexPolar) a;
        NumType.ComplexPolar y = (NumType.ComplexPolar) b;
        return approximatelyEqual(x.getModulus(), y.getModulus(), epsilon)
            && approximatelyEqual(x.getArgument(), y.getArgument(), epsilon);
      }
      case E_NOTATION: {
        NumType.ENotation x = (NumType.ENotation) a;
        NumType.ENotation y = (NumType.ENotation) b;
        return x.getExponent() == y.getExponent() && approximatelyEqual(x.getMantissa(), y.getMantissa(), epsilon);
      }
      default:
        return a.equals(b);
    }
  }

  public static boolean approximatelyEqual(MathNode a, MathNode b) {
    return approximatelyEqual(a, b, DEFAULT_EPSILON);
  }

  /**
   * Structural comparison of two trees, numbers compared with {@code epsilon}, everything else exactly.
   */
  public static boolean approximatelyEqual(MathNode a, MathNode b, double epsilon) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null || a.getClass() != b.getClass()) {
      return false;
    }
    if (a instanceof CnNode) {
      CnNode x = (CnNode) a;
      CnNode y = (CnNode) b;
      return x.getBase() == y.getBase()
          && Objects.equals(x.getDefinitionUrl(), y.getDefinitionUrl())
          && Objects.equals(x.getEncoding(), y.getEncoding())
          && Objects.equals(x.getAttributes(), y.getAttributes())
          && approximatelyEqual(x.getNumType(), y.getNumType(), epsilon);
    }
    if (a instanceof CsymbolNode) {
      CsymbolNode x = (CsymbolNode) a;
      CsymbolNode y = (CsymbolNode) b;
      if (!x.getDefinitionUrl().equals(y.getDefinitionUrl()) || !Objects.equals(x.getEncoding(), y.getEncoding())) {
        return false;
      }
    } else if (!(a instanceof AbstractParentNode)) {
      // leaves without numbers
      return a.equals(b);
    }
    List<MathNode> left = a.getChildren();
    List<MathNode> right = b.getChildren();
    if (left.size() != right.size()) {
      return false;
    }
    for (int i = 0; i < left.size(); i++) {
      if (!approximatelyEqual(left.get(i), right.get(i), epsilon)) {
        return false;
      }
    }
    return true;
  }

}
