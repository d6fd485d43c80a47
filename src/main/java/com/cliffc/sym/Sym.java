package com.cliffc.sym;

/** Symbolic simplification of algebraic expression trees.
 *
 *  Global tunables; read once from system properties.
 */
public abstract class Sym {
  // Max rounds for any fixed-point rewrite loop
  public static final int MAX_ROUNDS     = Integer.getInteger("sym.max_rounds"    ,10);
  // Max repeated exp cancellations inside one fraction
  public static final int MAX_CANCEL     = Integer.getInteger("sym.max_cancel"    , 5);
  // Largest integral power of a sum that is expanded by distribution
  public static final int MAX_EXPAND_POW = Integer.getInteger("sym.max_expand_pow",10);
  // Pad the strategy results up to this many forms
  public static final int MIN_FORMS      = Integer.getInteger("sym.min_forms"     , 3);
}
