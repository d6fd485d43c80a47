package com.cliffc.sym.ast;

import com.cliffc.sym.util.SB;
import com.cliffc.sym.util.Util;

import java.util.function.UnaryOperator;

// Binary operation.  Printing drops the "1*" and turns "(-1)*" into a unary
// minus, and inserts the fewest parens that keep the tree shape readable.
public final class Bin extends Expr {
  public final Op _op;
  public final Expr _l, _r;
  private Bin( Op op, Expr l, Expr r ) {
    super(Util.mix_hash(op.ordinal()+0x42494E,l._hash,r._hash));
    _op = op;
    _l = l;
    _r = r;
  }
  public static Bin make( Op op, Expr l, Expr r ) { return new Bin(op,l,r); }

  // Same operator, new kids; returns 'this' when both kids are unchanged
  public Bin set( Expr l, Expr r ) { return l==_l && r==_r ? this : new Bin(_op,l,r); }

  @Override boolean eq( Expr e ) {
    Bin b = (Bin)e;
    return _op==b._op && _l.equals(b._l) && _r.equals(b._r);
  }

  @Override public boolean is_op( Op op ) { return _op==op; }

  @Override public Expr xform( UnaryOperator<Expr> f ) {
    return f.apply(set(_l.xform(f),_r.xform(f)));
  }

  @Override public SB str( SB sb ) {
    if( _op==Op.MUL && _l instanceof Num n ) {
      if( n.is_num(-1) ) return kid(sb.p('-'),_r,false);
      if( n.is_num( 1) ) return kid(sb,_r,false);
    }
    kid(sb,_l,true).p(_op._sym);
    return kid(sb,_r,false);
  }

  private SB kid( SB sb, Expr kid, boolean left ) {
    return parens(kid,left) ? kid.str(sb.p('(')).p(')') : kid.str(sb);
  }

  private boolean parens( Expr kid, boolean left ) {
    if( kid instanceof Num n )  // (-2)^x
      return left && _op==Op.POW && n._con < 0;
    if( !(kid instanceof Bin b) ) return false;
    int kprec = b._op._prec;
    if( kprec < _op._prec ) return true;
    if( left ) return _op==Op.POW && kprec==_op._prec;
    if( _op==Op.SUB && kprec==Op.ADD._prec ) return true;
    if( _op==Op.DIV && kprec==Op.MUL._prec ) return true;
    return _op==Op.POW && kprec==_op._prec;
  }
}
