package com.cliffc.sym.ast;

import com.cliffc.sym.util.SB;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/** An algebraic expression tree: {@link Num}, {@link Var}, {@link Fun} or
 *  {@link Bin}.  The set of variants is closed; constructors are package
 *  private and every transformation dispatches on the four kinds.
 *
 *  <p>Trees are immutable values.  Equality is structural, with numbers
 *  compared to within {@link com.cliffc.sym.util.Util#EPS}.  The hash is
 *  computed once at construction and skips numeric values, so two trees that
 *  are equal-within-epsilon always hash alike.
 */
public abstract class Expr {
  public final int _hash;       // Structural hash, numbers excluded
  Expr( int hash ) { _hash = hash; }

  @Override public final int hashCode() { return _hash; }
  @Override public final boolean equals( Object o ) {
    if( this==o ) return true;
    if( !(o instanceof Expr e) ) return false;
    return _hash==e._hash && getClass()==e.getClass() && eq(e);
  }
  // Same class, same hash; compare fields
  abstract boolean eq( Expr e );

  // Plain-text rendering; the presentation form handed to display & export.
  @Override public final String toString() { return str(new SB()).toString(); }
  public abstract SB str( SB sb );

  // Bottom-up rewrite: all kids first, then 'f' on the rebuilt node.
  public abstract Expr xform( UnaryOperator<Expr> f );

  // Quick queries, overridden by the variants
  public boolean is_num() { return false; }
  public boolean is_num( double d ) { return false; }
  public boolean is_op( Op op ) { return false; }
  public boolean is_fun( String name ) { return false; }
  public final boolean is_sum() { return is_op(Op.ADD) || is_op(Op.SUB); }

  // Short builders
  public static Num num( double d ) { return Num.con(d); }
  public static Var var( String s ) { return Var.make(s); }
  public static Fun fun( String name, Expr arg ) { return Fun.make(name,arg); }
  public static Bin add( Expr l, Expr r ) { return Bin.make(Op.ADD,l,r); }
  public static Bin sub( Expr l, Expr r ) { return Bin.make(Op.SUB,l,r); }
  public static Bin mul( Expr l, Expr r ) { return Bin.make(Op.MUL,l,r); }
  public static Bin div( Expr l, Expr r ) { return Bin.make(Op.DIV,l,r); }
  public static Bin pow( Expr l, Expr r ) { return Bin.make(Op.POW,l,r); }
  public static Bin pow( Expr l, double n ) { return Bin.make(Op.POW,l,Num.con(n)); }
  public static Expr mul( Expr... es ) {
    Expr x = es[0];
    for( int i=1; i<es.length; i++ ) x = mul(x,es[i]);
    return x;
  }
  public static Expr add( Expr... es ) {
    Expr x = es[0];
    for( int i=1; i<es.length; i++ ) x = add(x,es[i]);
    return x;
  }

  // Flatten a MUL chain into its factors, left to right.  Never crosses a sum.
  public static List<Expr> factors( Expr e ) { return factors(e,new ArrayList<>()); }
  private static List<Expr> factors( Expr e, List<Expr> fs ) {
    if( e instanceof Bin b && b._op==Op.MUL ) { factors(b._l,fs); factors(b._r,fs); }
    else fs.add(e);
    return fs;
  }
  // Left-leaning MUL chain; 1 when empty
  public static Expr product( List<Expr> fs ) { return chain(Op.MUL,fs,Num.ONE); }
  // Left-leaning ADD chain; 0 when empty
  public static Expr sum( List<Expr> ts ) { return chain(Op.ADD,ts,Num.ZERO); }
  private static Expr chain( Op op, List<Expr> xs, Num empty ) {
    if( xs.isEmpty() ) return empty;
    Expr x = xs.get(0);
    for( int i=1; i<xs.size(); i++ ) x = Bin.make(op,x,xs.get(i));
    return x;
  }
}
