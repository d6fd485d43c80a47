package com.cliffc.sym.ast;

import com.cliffc.sym.util.SB;

import java.util.function.UnaryOperator;

// A free symbol.
public final class Var extends Expr {
  public final String _name;
  private Var( String name ) { super(name.hashCode()); _name = name; }
  public static Var make( String name ) { return new Var(name); }

  @Override boolean eq( Expr e ) { return _name.equals(((Var)e)._name); }
  @Override public SB str( SB sb ) { return sb.p(_name); }
  @Override public Expr xform( UnaryOperator<Expr> f ) { return f.apply(this); }
}
