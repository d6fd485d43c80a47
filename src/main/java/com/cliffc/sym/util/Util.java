package com.cliffc.sym.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class Util {
  // All coefficient, exponent and value compares go through this tolerance.
  public static final double EPS = 1e-10;

  public static boolean eq( double x, double y ) { return Math.abs(x-y) < EPS; }
  public static boolean is_zero( double x ) { return Math.abs(x) < EPS; }
  public static boolean is_one ( double x ) { return eq(x, 1.0); }
  public static boolean is_neg1( double x ) { return eq(x,-1.0); }
  // Close enough to an integer to print and expand as one
  public static boolean is_int( double x ) {
    return !Double.isInfinite(x) && !Double.isNaN(x) && Math.abs(x-Math.rint(x)) < EPS;
  }

  // Number as a person writes it; integral values lose the ".0".  Others
  // are rounded to the EPS grid, so 0.1+0.2 prints as "0.3".  Numbers more
  // than EPS apart never print alike.
  public static String fmt( double d ) {
    if( !Double.isFinite(d) ) return Double.toString(d);
    if( is_int(d) && Math.abs(d) < 1e15 ) {
      long l = (long)Math.rint(d);
      return Long.toString(l);  // Also folds -0.0 to "0"
    }
    BigDecimal b = new BigDecimal(d).setScale(10,RoundingMode.HALF_EVEN).stripTrailingZeros();
    return b.signum()==0 ? "0" : b.toPlainString();
  }

  // Euclid on doubles, iterative.  Inputs are magnitudes; result is never
  // negative.  Returns |x| when y is ~0.
  static public double gcd( double x, double y ) {
    double a = Math.abs(x), b = Math.abs(y);
    while( !is_zero(b) ) {
      double r = a % b;
      a = b;  b = r;
    }
    return a;
  }

  // Cheap hash mixer for structural hashes.  Order sensitive.
  static public int mix_hash( int h0, int h1 ) {
    int h = h0*0x9E3779B1 + h1;
    return h ^ (h>>>16);
  }
  static public int mix_hash( int h0, int h1, int h2 ) { return mix_hash(mix_hash(h0,h1),h2); }
}
