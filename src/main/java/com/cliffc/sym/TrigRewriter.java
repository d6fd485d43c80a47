package com.cliffc.sym;

import com.cliffc.sym.ast.*;
import com.cliffc.sym.util.Util;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/** Trigonometric identity rewriting.
 *
 *  <p>Each round runs three bottom-up passes: double-angle, Pythagorean, and
 *  the basic quotient/reciprocal identities.  Rounds repeat until the tree
 *  stops changing or {@link Sym#MAX_ROUNDS} is hit.  Adjacent numeric
 *  factors are folded once at the end.
 */
public final class TrigRewriter {
  private static final Logger LOG = LoggerFactory.getLogger(TrigRewriter.class);
  private TrigRewriter() {}

  public static @NotNull Expr simplify( Expr e ) {
    Expr x = e;
    for( int i=0; i<Sym.MAX_ROUNDS; i++ ) {
      Expr y = x.xform(TrigRewriter::double_angle)
                .xform(TrigRewriter::pythagorean)
                .xform(TrigRewriter::identities);
      if( y.equals(x) ) break;
      LOG.debug("trig round {}: {}",i,y);
      x = y;
    }
    return fold_coefs(x);
  }

  // k*sin(t)*cos(t) ==> (k/2)*sin(2*t)
  // k*cos(t)^2 - k*sin(t)^2 ==> k*cos(2*t), and the same with +(-k)
  private static Expr double_angle( Expr e ) {
    if( !(e instanceof Bin b) ) return e;
    return switch( b._op ) {
    case MUL -> sin_cos(b);
    case SUB -> cos2_sin2(b, 1);
    case ADD -> cos2_sin2(b,-1);
    default  -> b;
    };
  }

  private static Expr sin_cos( Bin b ) {
    double k = 1;
    Fun sin = null, cos = null;
    for( Expr x : Expr.factors(b) ) {
      if( x instanceof Num n ) k *= n._con;
      else if( x.is_fun("sin") && sin==null ) sin = (Fun)x;
      else if( x.is_fun("cos") && cos==null ) cos = (Fun)x;
      else return b;            // Anything else, or a second sin or cos
    }
    if( sin==null || cos==null || !sin._arg.equals(cos._arg) ) return b;
    LOG.debug("double angle: {}",b);
    return scaled(k/2,Fun.make("sin",twice(sin._arg)));
  }

  private static Expr cos2_sin2( Bin b, double sign ) {
    Sq cos = squared(b._l,"cos");
    Sq sin = squared(b._r,"sin");
    if( cos==null || sin==null || !cos._angle.equals(sin._angle) || !Util.eq(cos._k,sign*sin._k) )
      return b;
    LOG.debug("double angle: {}",b);
    return scaled(cos._k,Fun.make("cos",twice(cos._angle)));
  }

  // k*sin(t)^2 + k*cos(t)^2 ==> k, either order
  private static Expr pythagorean( Expr e ) {
    if( !(e instanceof Bin b) || b._op!=Op.ADD ) return e;
    Sq sin = squared(b._l,"sin"), cos = squared(b._r,"cos");
    if( sin==null || cos==null ) { cos = squared(b._l,"cos"); sin = squared(b._r,"sin"); }
    if( sin==null || cos==null || !sin._angle.equals(cos._angle) || !Util.eq(sin._k,cos._k) )
      return b;
    LOG.debug("pythagorean: {}",b);
    return Num.con(sin._k);
  }

  // sin/cos ==> tan, cos/sin ==> cot, 1/cos ==> sec, 1/sin ==> csc
  private static Expr identities( Expr e ) {
    if( !(e instanceof Bin b) || b._op!=Op.DIV ) return e;
    if( b._l instanceof Fun n && b._r instanceof Fun d && n._arg.equals(d._arg) ) {
      if( n.is_fun("sin") && d.is_fun("cos") ) return Fun.make("tan",n._arg);
      if( n.is_fun("cos") && d.is_fun("sin") ) return Fun.make("cot",n._arg);
    }
    if( b._l.is_num(1) && b._r instanceof Fun d ) {
      if( d.is_fun("cos") ) return Fun.make("sec",d._arg);
      if( d.is_fun("sin") ) return Fun.make("csc",d._arg);
    }
    return b;
  }

  // A coefficient times fun(t)^2, and nothing else
  private static final class Sq {
    final double _k;
    final Expr _angle;
    Sq( double k, Expr angle ) { _k=k; _angle=angle; }
  }
  private static Sq squared( Expr e, String name ) {
    double k = 1, pow = 1;
    Fun f = null;
    for( Expr x : Expr.factors(e) ) {
      if( x instanceof Num n ) k *= n._con;
      else if( x instanceof Bin p && p._op==Op.POW ) {
        if( !(p._l.is_fun(name) && p._r instanceof Num n) ) return null;
        f = (Fun)p._l;
        pow = n._con;
      } else if( x.is_fun(name) ) {
        f = (Fun)x;
        pow = 1;
      } else return null;
    }
    return f!=null && Util.eq(pow,2) ? new Sq(k,f._arg) : null;
  }

  private static Expr twice( Expr t ) { return Expr.mul(Num.TWO,t); }
  private static Expr scaled( double k, Expr x ) { return Util.is_one(k) ? x : Expr.mul(Num.con(k),x); }

  // Collapse runs of adjacent numbers in every MUL chain; a product of 1
  // drops out.
  static Expr fold_coefs( Expr e ) {
    if( e instanceof Fun f ) return f.set_arg(fold_coefs(f._arg));
    if( !(e instanceof Bin b) ) return e;
    if( b._op!=Op.MUL ) return b.set(fold_coefs(b._l),fold_coefs(b._r));
    ArrayList<Expr> fs = new ArrayList<>();
    for( Expr x : Expr.factors(b) ) {
      Expr y = fold_coefs(x);
      int last = fs.size()-1;
      if( y instanceof Num n && last >= 0 && fs.get(last) instanceof Num m ) fs.set(last,Num.con(m._con*n._con));
      else fs.add(y);
    }
    fs.removeIf(x -> x.is_num(1));
    return Expr.product(fs);
  }
}
