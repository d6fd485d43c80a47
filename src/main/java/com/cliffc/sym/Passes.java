package com.cliffc.sym;

import com.cliffc.sym.ast.*;
import com.cliffc.sym.util.Util;
import org.jetbrains.annotations.NotNull;

/** Small local cleanups, each a single bottom-up walk.  None of these
 *  expands or reorders anything. */
public final class Passes {
  private Passes() {}

  // Constant sub-expressions.  Division by ~0 and non-finite results stay.
  public static @NotNull Expr fold( Expr e ) { return e.xform(Passes::fold1); }
  private static Expr fold1( Expr e ) {
    if( !(e instanceof Bin b && b._l instanceof Num l && b._r instanceof Num r) ) return e;
    double x = l._con, y = r._con;
    double d = switch( b._op ) {
    case ADD -> x+y;
    case SUB -> x-y;
    case MUL -> x*y;
    case DIV -> Util.is_zero(y) ? Double.NaN : x/y;
    case POW -> Math.pow(x,y);
    };
    return Double.isFinite(d) ? Num.con(d) : e;
  }

  // 0+e, e+0, e-0 ==> e;  0*e, e*0 ==> 0
  public static @NotNull Expr dropZero( Expr e ) { return e.xform(Passes::dropZero1); }
  private static Expr dropZero1( Expr e ) {
    if( !(e instanceof Bin b) ) return e;
    return switch( b._op ) {
    case ADD -> b._l.is_num(0) ? b._r : (b._r.is_num(0) ? b._l : b);
    case SUB -> b._r.is_num(0) ? b._l : b;
    case MUL -> b._l.is_num(0) || b._r.is_num(0) ? Num.ZERO : b;
    default  -> b;
    };
  }

  // 1*e, e*1, e/1 ==> e
  public static @NotNull Expr dropOne( Expr e ) { return e.xform(Passes::dropOne1); }
  private static Expr dropOne1( Expr e ) {
    if( !(e instanceof Bin b) ) return e;
    return switch( b._op ) {
    case MUL -> b._l.is_num(1) ? b._r : (b._r.is_num(1) ? b._l : b);
    case DIV -> b._r.is_num(1) ? b._l : b;
    default  -> b;
    };
  }

  // e^0 ==> 1;  e^1 ==> e
  public static @NotNull Expr simplifyPowers( Expr e ) { return e.xform(Passes::powers1); }
  private static Expr powers1( Expr e ) {
    if( !(e instanceof Bin b) || b._op!=Op.POW ) return e;
    if( b._r.is_num(0) ) return Num.ONE;
    if( b._r.is_num(1) ) return b._l;
    return b;
  }

  // (-1)*(-1) ==> 1;  e*(-1) ==> (-1)*e
  public static @NotNull Expr negOne( Expr e ) { return e.xform(Passes::negOne1); }
  private static Expr negOne1( Expr e ) {
    if( !(e instanceof Bin b) || b._op!=Op.MUL ) return e;
    if( b._l.is_num(-1) && b._r.is_num(-1) ) return Num.ONE;
    if( b._r.is_num(-1) ) return Expr.mul(Num.NEG1,b._l);
    return b;
  }

  // (-1)*((-1)*e) ==> e
  public static @NotNull Expr doubleNeg( Expr e ) { return e.xform(Passes::doubleNeg1); }
  private static Expr doubleNeg1( Expr e ) {
    if( e instanceof Bin b && b._op==Op.MUL && b._l.is_num(-1) &&
        b._r instanceof Bin r && r._op==Op.MUL && r._l.is_num(-1) )
      return r._r;
    return e;
  }

  // Tidy a freshly built tree (e.g. a raw derivative) before canonicalizing
  public static @NotNull Expr clean( Expr e ) {
    Expr x = dropZero(e);
    x = dropOne(x);
    x = negOne(x);
    x = doubleNeg(x);
    x = dropZero(x);
    return simplifyPowers(x);
  }
}
