package com.cliffc.sym.ast;

// Binary operators, with the printing symbol and binding precedence.
public enum Op {
  ADD("+",1),
  SUB("-",1),
  MUL("*",2),
  DIV("/",2),
  POW("^",3);

  public final String _sym;
  public final int _prec;
  Op( String sym, int prec ) { _sym=sym; _prec=prec; }

  public boolean is_additive() { return _prec==1; }
}
