package com.cliffc.sym.ast;

import com.cliffc.sym.util.SB;
import com.cliffc.sym.util.Util;

import java.util.function.UnaryOperator;

// A literal constant.
public final class Num extends Expr {
  // All numbers share one hash; value compares are epsilon-based and cannot
  // be hashed consistently.
  private static final int NUM_HASH = 0x4E554D;
  public final double _con;
  private Num( double con ) { super(NUM_HASH); _con = con; }

  public static final Num ZERO = new Num( 0);
  public static final Num ONE  = new Num( 1);
  public static final Num NEG1 = new Num(-1);
  public static final Num TWO  = new Num( 2);
  public static Num con( double d ) {
    if( d== 0 ) return ZERO;    // Also folds -0.0
    if( d== 1 ) return ONE ;
    if( d==-1 ) return NEG1;
    if( d== 2 ) return TWO ;
    return new Num(d);
  }

  @Override boolean eq( Expr e ) { return Util.eq(_con,((Num)e)._con); }
  @Override public SB str( SB sb ) { return sb.p(_con); }
  @Override public Expr xform( UnaryOperator<Expr> f ) { return f.apply(this); }

  @Override public boolean is_num() { return true; }
  @Override public boolean is_num( double d ) { return Util.eq(_con,d); }
}
