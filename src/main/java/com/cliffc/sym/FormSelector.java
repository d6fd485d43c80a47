package com.cliffc.sym;

import com.cliffc.sym.ast.*;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Pick the candidate that is cheapest to differentiate.
 *
 *  <p>The cost is a structural estimate of how much the derivative rules
 *  will blow up each node: products and quotients spawn extra terms, and
 *  symbolic powers are the most expensive.  Ties go to the first candidate.
 */
public final class FormSelector {
  private static final Logger LOG = LoggerFactory.getLogger(FormSelector.class);
  private FormSelector() {}

  public static @NotNull Expr selectBestForDifferentiation( List<Expr> cands ) {
    if( cands.isEmpty() ) throw new IllegalArgumentException("empty input: no candidate forms to select from");
    if( cands.size()==1 ) return cands.get(0);
    Expr best = cands.get(0);
    long min = cost(best);
    for( Expr e : cands ) {
      long c = cost(e);
      LOG.debug("cost {}: {}",c,e);
      if( c < min ) { min = c; best = e; }
    }
    LOG.debug("selected {}",best);
    return best;
  }

  public static @NotNull Form selectBestForm( List<Form> forms ) {
    if( forms.isEmpty() ) throw new IllegalArgumentException("empty input: no candidate forms to select from");
    Form best = forms.get(0);
    long min = cost(best._expr);
    for( Form f : forms ) {
      long c = cost(f._expr);
      if( c < min ) { min = c; best = f; }
    }
    return best;
  }
  public static @NotNull Form selectBestForm( Forms forms ) { return selectBestForm(forms.forms()); }

  // Saturates at Long.MAX_VALUE on deep product and quotient chains
  public static long cost( Expr e ) {
    if( e instanceof Num ) return 0;
    if( e instanceof Var ) return 1;
    if( e instanceof Fun f ) return add(3,cost(f._arg));
    Bin b = (Bin)e;
    long l = cost(b._l), r = cost(b._r);
    return switch( b._op ) {
    case ADD, SUB -> add(add(l,r),1);
    case MUL -> mul(add(l,r),2);
    case DIV -> mul(add(l,r),3);
    case POW -> b._r instanceof Num ? add(mul(l,2),2) : mul(add(l,r),4);
    };
  }
  private static long add( long x, long y ) { return x > Long.MAX_VALUE-y ? Long.MAX_VALUE : x+y; }
  private static long mul( long x, int k ) { return x > Long.MAX_VALUE/k ? Long.MAX_VALUE : x*k; }

  // Node, division, power and function counts plus the cost, for logging
  public static String statistics( Expr e ) {
    int[] cnts = new int[4];
    count(e,cnts);
    return "nodes:"+cnts[0]+", divisions:"+cnts[1]+", powers:"+cnts[2]+", functions:"+cnts[3]+", cost:"+cost(e);
  }
  private static void count( Expr e, int[] cnts ) {
    cnts[0]++;
    if( e instanceof Fun f ) { cnts[3]++; count(f._arg,cnts); }
    if( e instanceof Bin b ) {
      if( b._op==Op.DIV ) cnts[1]++;
      if( b._op==Op.POW ) cnts[2]++;
      count(b._l,cnts);
      count(b._r,cnts);
    }
  }
}
