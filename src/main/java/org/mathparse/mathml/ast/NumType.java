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

import java.util.Objects;

/**
 * The typed value of a {@code <cn>} element.
 * <p>
 * {@link #equals(Object)} is exact (floating point components are compared with {@link Double#compare}). Use
 * {@link TolerantEquality} for epsilon based comparison.
 */
public abstract class NumType {

  /**
   * The {@code type} attribute values of {@code <cn>}.
   */
  public enum Kind {
    REAL("real"),
    INTEGER("integer"),
    RATIONAL("rational"),
    COMPLEX_CARTESIAN("complex-cartesian"),
    COMPLEX_POLAR("complex-polar"),
    CONSTANT("constant"),
    E_NOTATION("e-notation");

    private final String typeName;

    Kind(String typeName) {
      this.typeName = typeName;
    }

    public String getTypeName() {
      return typeName;
    }

    /**
     * @param typeName value of the {@code type} attribute, case-sensitive
     * @return the kind, or {@code null} if not supported
     */
    public static Kind forTypeName(String typeName) {
      for (Kind kind : values()) {
        if (kind.typeName.equals(typeName)) {
          return kind;
        }
      }
      return null;
    }
  }

  private NumType() {
    // closed hierarchy
  }

  public abstract Kind getKind();

  public static Real real(double value) {
    return new Real(value);
  }

  public static Int integer(long value) {
    return new Int(value);
  }

  public static Rational rational(long numerator, long denominator) {
    return new Rational(numerator, denominator);
  }

  public static ComplexCartesian complexCartesian(double real, double imaginary) {
    return new ComplexCartesian(real, imaginary);
  }

  public static ComplexPolar complexPolar(double modulus, double argument) {
    return new ComplexPolar(modulus, argument);
  }

  public static Constant constant(String name) {
    return new Constant(name);
  }

  public static ENotation eNotation(double mantissa, long exponent) {
    return new ENotation(mantissa, exponent);
  }

  public static final class Real extends NumType {
    private final double value;

    private Real(double value) {
      this.value = value;
    }

    public double getValue() {
      return value;
    }

    @Override
    public Kind getKind() {
      return Kind.REAL;
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof Real && Double.compare(value, ((Real) o).value) == 0);
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value);
    }

    @Override
    public String toString() {
      return "Real(" + value + ")";
    }
  }

  public static final class Int extends NumType {
    private final long value;

    private Int(long value) {
      this.value = value;
    }

    public long getValue() {
      return value;
    }

    @Override
    public Kind getKind() {
      return Kind.INTEGER;
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof Int && value == ((Int) o).value);
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }

    @Override
    public String toString() {
      return "Integer(" + value + ")";
    }
  }

  /**
   * Numerator and denominator exactly as written, never reduced.
   */
  public static final class Rational extends NumType {
    private final long numerator;
    private final long denominator;

    private Rational(long numerator, long denominator) {
      this.numerator = numerator;
      this.denominator = denominator;
    }

    public long getNumerator() {
      return numerator;
    }

    public long getDenominator() {
      return denominator;
    }

    @Override
    public Kind getKind() {
      return Kind.RATIONAL;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Rational)) {
        return false;
      }
      Rational that = (Rational) o;
      return numerator == that.numerator && denominator == that.denominator;
    }

    @Override
    public int hashCode() {
      return Objects.hash(numerator, denominator);
    }

    @Override
    public String toString() {
      return "Rational(" + numerator + ", " + denominator + ")";
    }
  }

  public static final class ComplexCartesian extends NumType {
    private final double real;
    private final double imaginary;

    private ComplexCartesian(double real, double imaginary) {
      this.real = real;
      this.imaginary = imaginary;
    }

    public double getReal() {
      return real;
    }

    public double getImaginary() {
      return imaginary;
    }

    @Override
    public Kind getKind() {
      return Kind.COMPLEX_CARTESIAN;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof ComplexCartesian)) {
        return false;
      }
      ComplexCartesian that = (ComplexCartesian) o;
      return Double.compare(real, that.real) == 0 && Double.compare(imaginary, that.imaginary) == 0;
    }

    @Override
    public int hashCode() {
      return Objects.hash(real, imaginary);
    }

    @Override
    public String toString() {
      return "ComplexCartesian(" + real + ", " + imaginary + ")";
    }
  }

  public static final class ComplexPolar extends NumType {
    private final double modulus;
    private final double argument;

    private ComplexPolar(double modulus, double argument) {
      this.modulus = modulus;
      this.argument = argument;
    }

    public double getModulus() {
      return modulus;
    }

    public double getArgument() {
      return argument;
    }

    @Override
    public Kind getKind() {
      return Kind.COMPLEX_POLAR;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof ComplexPolar)) {
        return false;
      }
      ComplexPolar that = (ComplexPolar) o;
      return Double.compare(modulus, that.modulus) == 0 && Double.compare(argument, that.argument) == 0;
    }

    @Override
    public int hashCode() {
      return Objects.hash(modulus, argument);
    }

    @Override
    public String toString() {
      return "ComplexPolar(" + modulus + ", " + argument + ")";
    }
  }

  /**
   * A symbolic constant, e.g. {@code $FIXED_tau} left behind by the entity sanitizer.
   */
  public static final class Constant extends NumType {
    private final String name;

    private Constant(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
      return name;
    }

    @Override
    public Kind getKind() {
      return Kind.CONSTANT;
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof Constant && name.equals(((Constant) o).name));
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return "Constant(" + name + ")";
    }
  }

  /**
   * {@code mantissa * 10^exponent}.
   */
  public static final class ENotation extends NumType {
    private final double mantissa;
    private final long exponent;

    private ENotation(double mantissa, long exponent) {
      this.mantissa = mantissa;
      this.exponent = exponent;
    }

    public double getMantissa() {
      return mantissa;
    }

    public long getExponent() {
      return exponent;
    }

    @Override
    public Kind getKind() {
      return Kind.E_NOTATION;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof ENotation)) {
        return false;
      }
      ENotation that = (ENotation) o;
      return Double.compare(mantissa, that.mantissa) == 0 && exponent == that.exponent;
    }

    @Override
    public int hashCode() {
      return Objects.hash(mantissa, exponent);
    }

    @Override
    public String toString() {
      return "ENotation(" + mantissa + ", " + exponent + ")";
    }
  }

}
