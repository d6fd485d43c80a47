package com.cliffc.sym.ast;

import com.cliffc.sym.util.SB;
import com.cliffc.sym.util.Util;

import java.util.function.UnaryOperator;

// Opaque unary application: sin, cos, tan, exp, ln, sqrt, ...  Rewrites
// never look inside the function itself, only at and below its argument.
public final class Fun extends Expr {
  public final String _name;
  public final Expr _arg;
  private Fun( String name, Expr arg ) {
    super(Util.mix_hash(name.hashCode(),arg._hash));
    _name = name;
    _arg = arg;
  }
  public static Fun make( String name, Expr arg ) { return new Fun(name,arg); }

  // Same function, new argument; returns 'this' when the argument is unchanged
  public Fun set_arg( Expr arg ) { return arg==_arg ? this : new Fun(_name,arg); }

  @Override boolean eq( Expr e ) {
    Fun f = (Fun)e;
    return _name.equals(f._name) && _arg.equals(f._arg);
  }
  @Override public SB str( SB sb ) { return _arg.str(sb.p(_name).p('(')).p(')'); }
  @Override public Expr xform( UnaryOperator<Expr> f ) { return f.apply(set_arg(_arg.xform(f))); }

  @Override public boolean is_fun( String name ) { return _name.equals(name); }
}
