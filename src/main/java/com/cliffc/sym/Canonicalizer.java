package com.cliffc.sym;

import com.cliffc.sym.ast.*;
import com.cliffc.sym.term.Term;
import com.cliffc.sym.util.Util;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/** Canonical polynomial form.
 *
 *  <p>The expression is fully expanded (products distributed over sums,
 *  small integral powers of sums multiplied out), split into signed summands,
 *  like terms merged, and the survivors laid out highest-degree first with
 *  constants last.  A division at the root is never crossed: numerator and
 *  denominator are each canonicalized on their own.
 *
 *  <p>The result is a unique form for any expression not dominated by a
 *  division, and canonicalizing it again changes nothing.
 */
public final class Canonicalizer {
  private static final Logger LOG = LoggerFactory.getLogger(Canonicalizer.class);
  private Canonicalizer() {}

  public static @NotNull Expr canonicalize( Expr e ) {
    Expr x = e instanceof Bin b && b._op==Op.DIV
      ? b.set(polynomial(b._l),polynomial(b._r))
      : polynomial(e);
    LOG.debug("canonicalize {} ==> {}",e,x);
    return x;
  }

  private static Expr polynomial( Expr e ) {
    List<Term> ts = merge(terms(expand(e)));
    sort(ts);
    ArrayList<Expr> xs = new ArrayList<>();
    for( Term t : ts ) xs.add(t.expr());
    return Expr.sum(xs);
  }

  // ------------------------------------------------------------------------
  // Full expansion.  Function internals are opaque, only their arguments
  // expand.  Divisions expand both sides but never distribute.
  static Expr expand( Expr e ) {
    if( e instanceof Fun f ) return f.set_arg(expand(f._arg));
    if( !(e instanceof Bin b) ) return e;
    Expr l = expand(b._l), r = expand(b._r);
    return switch( b._op ) {
    case ADD, SUB, DIV -> b.set(l,r);
    case MUL -> expand_mul(l,r);
    case POW -> expand_pow(b,l,r);
    };
  }

  // Distribute a product over any sums on either side
  static Expr expand_mul( Expr l, Expr r ) {
    boolean ls = l.is_sum(), rs = r.is_sum();
    if( !ls && !rs ) return mul_simple(l,r);
    List<Expr> lts = ls ? flatten_sum(l) : List.of(l);
    List<Expr> rts = rs ? flatten_sum(r) : List.of(r);
    ArrayList<Expr> ps = new ArrayList<>();
    for( Expr lt : lts )
      for( Expr rt : rts )
        ps.add(mul_simple(lt,rt));
    return Expr.sum(ps);
  }

  // Product of two non-sums, collected into a single term
  private static Expr mul_simple( Expr l, Expr r ) {
    if( l instanceof Num a && r instanceof Num b ) return Num.con(a._con*b._con);
    if( l.is_num(0) || r.is_num(0) ) return Num.ZERO;
    if( l.is_num(1) ) return r;
    if( r.is_num(1) ) return l;
    return Term.of(l).mul(Term.of(r)).expr();
  }

  private static Expr expand_pow( Bin pow, Expr base, Expr x ) {
    if( !(x instanceof Num n) ) return pow.set(base,x);
    // (b^m)^n ==> b^(m*n), then the folded power goes through the rules below
    if( base instanceof Bin b && b._op==Op.POW && b._r instanceof Num m ) {
      Num mn = Num.con(m._con*n._con);
      return expand_pow(Bin.make(Op.POW,b._l,mn),b._l,mn);
    }
    if( base instanceof Var ) return pow.set(base,x);
    if( base instanceof Num m ) {
      double d = Math.pow(m._con,n._con);
      return Double.isFinite(d) ? Num.con(d) : pow.set(base,x);
    }
    double d = n._con;
    if( !Util.is_int(d) || d < 0 || d > Sym.MAX_EXPAND_POW ) return pow.set(base,x);
    int k = (int)Math.rint(d);
    if( k==0 ) return Num.ONE;
    if( k==1 ) return base;
    if( !base.is_sum() ) return pow.set(base,x);
    Expr p = base;
    for( int i=1; i<k; i++ ) p = expand_mul(p,base);
    return p;
  }

  // ------------------------------------------------------------------------
  // Signed summands of a top-level ADD/SUB chain
  public static List<Expr> flatten_sum( Expr e ) { return flatten_sum(e,new ArrayList<>()); }
  private static List<Expr> flatten_sum( Expr e, List<Expr> ts ) {
    if( e instanceof Bin b && b._op==Op.ADD ) {
      flatten_sum(b._l,ts);
      flatten_sum(b._r,ts);
    } else if( e instanceof Bin b && b._op==Op.SUB ) {
      flatten_sum(b._l,ts);
      for( Expr t : flatten_sum(b._r) ) ts.add(negate(t));
    } else ts.add(e);
    return ts;
  }

  // -e, pushing the sign into a leading coefficient when there is one
  public static Expr negate( Expr e ) {
    if( e instanceof Num n ) return Num.con(-n._con);
    if( e instanceof Bin b && b._op==Op.MUL && b._l instanceof Num n )
      return b.set(Num.con(-n._con),b._r);
    return Expr.mul(Num.NEG1,e);
  }

  static List<Term> terms( Expr e ) {
    ArrayList<Term> ts = new ArrayList<>();
    for( Expr x : flatten_sum(e) ) ts.add(Term.of(x));
    return ts;
  }

  // Group by base key and add up like terms.  Groups keep first-seen order;
  // a zero sum drops out.
  static List<Term> merge( List<Term> ts ) {
    LinkedHashMap<String,List<Term>> groups = new LinkedHashMap<>();
    for( Term t : ts ) {
      List<Term> group = groups.computeIfAbsent(t.base_key(),k -> new ArrayList<>());
      boolean merged = false;
      for( int i=0; i<group.size() && !merged; i++ ) {
        Term m = group.get(i).merge(t);
        if( m != null ) { group.set(i,m); merged = true; }
      }
      if( !merged ) group.add(t);
    }
    ArrayList<Term> rez = new ArrayList<>();
    for( List<Term> group : groups.values() )
      for( Term t : group )
        if( !t.is_zero() ) rez.add(t);
    return rez;
  }

  // Non-constants first, then by total variable degree descending, then by
  // base key, then by coefficient.  Independent of the incoming order.
  static final Comparator<Term> ORDER = Comparator
    .<Term,Boolean>comparing(Term::is_const)
    .thenComparing(Term::degree,Comparator.reverseOrder())
    .thenComparing(Term::base_key)
    .thenComparingDouble(t -> t._coef);

  public static void sort( List<Term> ts ) { ts.sort(ORDER); }
}
