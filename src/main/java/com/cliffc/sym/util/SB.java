package com.cliffc.sym.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing.
 *  Numbers print the way a person writes them: "2" and not "2.0". */
public final class SB {
  public final StringBuilder _sb;
  public SB() { _sb = new StringBuilder(); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  public SB p( long   s ) { _sb.append(s); return this; }
  // Math-text append of double
  public SB p( double s ) { _sb.append(Util.fmt(s)); return this; }
  // Not spelled "p" on purpose: too easy to accidentally say "p(1.0)" and
  // suddenly call the autoboxed version.
  public SB pobj( Object s ) { _sb.append(s.toString()); return this; }
  // Separator between list items; "unchar" drops a trailing one.
  public SB unchar() { _sb.setLength(_sb.length()-1); return this; }
  public int len() { return _sb.length(); }
  @Override public String toString() { return _sb.toString(); }
}
