package com.cliffc.sym.term;

import com.cliffc.sym.ast.Expr;
import com.cliffc.sym.ast.Fun;
import com.cliffc.sym.util.Util;
import org.jetbrains.annotations.NotNull;

/** Identity of a function factor: name plus argument tree.  Two keys are
 *  equal when the names match and the arguments are structurally equal, so
 *  {@code exp(x-9)} built twice lands in the same map slot.  Ordered by the
 *  rendered {@code name(arg)} text, which is only used to lay out output and
 *  build base keys.  Numbers render rounded to {@link Util#EPS}, so keys equal
 *  within EPS nearly always render alike; the ordering is not consistent with
 *  equals, and structurally different arguments may render alike, so sort
 *  keys in lists rather than TreeSets.
 */
public final class FunKey implements Comparable<FunKey> {
  public final String _name;
  public final Expr _arg;
  private String _str;          // Lazy rendering, sort key
  FunKey( String name, Expr arg ) { _name = name; _arg = arg; }
  public static FunKey make( Fun f ) { return new FunKey(f._name,f._arg); }

  public @NotNull Fun fun() { return Fun.make(_name,_arg); }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof FunKey fk && _name.equals(fk._name) && _arg.equals(fk._arg);
  }
  @Override public int hashCode() { return _name.hashCode()*31 + _arg.hashCode(); }
  @Override public int compareTo( FunKey fk ) { return toString().compareTo(fk.toString()); }
  @Override public String toString() {
    return _str==null ? (_str = _name+"("+_arg+")") : _str;
  }
}
