package com.cliffc.sym;

import com.cliffc.sym.ast.Expr;

// One candidate rendering of an expression, with what kind of rewrite made it
// and a short label for a UI to show next to it.
public class Form {
  public enum Kind {
    EXPANDED,                   // Fully multiplied out
    FACTORED,                   // Common factor pulled out, or cancelled
    GROUPED,                    // Factors regrouped across a fraction bar
    STRUCTURAL,                 // Shape kept, local cleanups only
  }

  public final Expr _expr;
  public final Kind _kind;
  public final String _label;
  public Form( Expr expr, Kind kind, String label ) { _expr=expr; _kind=kind; _label=label; }

  @Override public String toString() { return _label+" ["+_kind+"]: "+_expr; }
}
