package com.cliffc.sym;

import com.cliffc.sym.Form.Kind;
import com.cliffc.sym.ast.*;
import com.cliffc.sym.term.FunKey;
import com.cliffc.sym.term.Term;
import com.cliffc.sym.util.Util;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.UnaryOperator;

/** Factored and cancelled alternatives of an (already canonical) expression.
 *
 *  <p>A sum gets its greatest common factor pulled out: the GCD of the
 *  coefficients times every variable and function power present in all
 *  summands.  A fraction gets its numerator factored, then same-argument
 *  {@code exp} powers cancelled across the bar, then structurally equal
 *  factors cancelled.
 */
public final class FormGenerator {
  private static final Logger LOG = LoggerFactory.getLogger(FormGenerator.class);
  private FormGenerator() {}

  public static @NotNull Forms generateAllForms( Expr e ) {
    Forms forms = new Forms().add(e,Kind.EXPANDED,"standard");
    if( e instanceof Bin b && b._op==Op.DIV ) {
      Expr num = attempt(forms,"numerator factored",b._l,FormGenerator::extractCommonFactor);
      Expr fact = num.equals(b._l) ? b : Expr.div(num,b._r);
      Expr canc = attempt(forms,"exp cancelled",fact,FormGenerator::simplifyExpInFraction);
      if( !fact.equals(e) ) forms.add(fact,Kind.FACTORED,"numerator factored");
      if( !canc.equals(e) && !canc.equals(fact) ) forms.add(canc,Kind.FACTORED,"exp cancelled");
    } else {
      Expr fact = attempt(forms,"factored",e,FormGenerator::extractCommonFactor);
      if( !fact.equals(e) ) forms.add(fact,Kind.FACTORED,"factored");
    }
    Expr red = attempt(forms,"common factors cancelled",forms.last()._expr,FormGenerator::reduceFraction);
    if( !forms.contains(red) ) forms.add(red,Kind.GROUPED,"common factors cancelled");
    LOG.debug("{} forms of {}",forms.size(),e);
    return forms;
  }

  // Failure means the form is not produced
  private static Expr attempt( Forms forms, String label, Expr e, UnaryOperator<Expr> fn ) {
    try {
      return fn.apply(e);
    } catch( RuntimeException ex ) {
      LOG.warn("{} failed on {}",label,e,ex);
      forms.err(ErrMsg.form(label,e,ex));
      return e;
    }
  }

  // ------------------------------------------------------------------------
  /** GCD x (sum of summand/GCD).  Only a sum of two or more summands is
   *  factored; anything else, or a sum with nothing in common, comes back
   *  unchanged. */
  public static @NotNull Expr extractCommonFactor( Expr e ) {
    if( !e.is_sum() ) return e;
    ArrayList<Term> ts = new ArrayList<>();
    for( Expr x : Canonicalizer.flatten_sum(e) ) ts.add(Term.of(merge_powers(x)));
    if( ts.size() < 2 ) return e;
    Term gcd = gcd(ts);
    if( gcd.is_unit() || gcd.is_zero() ) return e;
    if( !divides(gcd,ts) ) {
      LOG.debug("common factor {} does not divide every summand, coefficient only",gcd);
      gcd = Term.con(gcd._coef);
    }
    ArrayList<Expr> rem = new ArrayList<>();
    for( Term t : ts ) rem.add(t.div(gcd).expr());
    Expr sum = Expr.sum(rem);
    return gcd.is_unit() ? sum : Expr.mul(gcd.expr(),sum);
  }

  // f(x)*f(x)^2 ==> f(x)^3 within one summand.  Divisions are left alone.
  static Expr merge_powers( Expr e ) {
    if( e.is_op(Op.DIV) ) return e;
    List<Expr> fs = Expr.factors(e);
    if( fs.size() <= 1 ) return e;
    LinkedHashMap<FunKey,Double> pows = new LinkedHashMap<>();
    ArrayList<Expr> rest = new ArrayList<>();
    for( Expr f : fs ) {
      if( f instanceof Fun fun ) pows.merge(FunKey.make(fun),1.0,Double::sum);
      else if( f instanceof Bin p && p._op==Op.POW && p._l instanceof Fun fun && p._r instanceof Num n )
        pows.merge(FunKey.make(fun),n._con,Double::sum);
      else rest.add(f);
    }
    pows.forEach((k,x) -> rest.add(Util.is_one(x) ? k.fun() : (Util.is_zero(x) ? Num.ONE : Expr.pow(k.fun(),x))));
    return rest.size()==fs.size() ? e : Expr.product(rest);
  }

  // Coefficient GCD by Euclid; per symbol the least exponent, negative ones
  // included, but only for symbols present in every summand.
  static Term gcd( List<Term> ts ) {
    double c = Math.abs(ts.get(0)._coef);
    for( int i=1; i<ts.size(); i++ ) c = Util.gcd(c,ts.get(i)._coef);
    HashMap<String,Double> vars = new HashMap<>();
    for( String s : ts.get(0).vars() ) {
      double min = Double.MAX_VALUE;
      for( Term t : ts ) {
        if( !t.has_var(s) ) { min = 0; break; } // Missing from a summand
        min = Math.min(min,t.var(s));
      }
      if( !Util.is_zero(min) ) vars.put(s,min);
    }
    HashMap<FunKey,Double> funs = new HashMap<>();
    for( FunKey k : ts.get(0).funs() ) {
      double min = Double.MAX_VALUE;
      for( Term t : ts ) {
        if( !t.has_fun(k) ) { min = 0; break; }
        min = Math.min(min,t.fun(k));
      }
      if( !Util.is_zero(min) ) funs.put(k,min);
    }
    return Term.make(c,vars,funs,List.of());
  }

  // Every summand has at least the GCD's exponent of every GCD symbol
  private static boolean divides( Term gcd, List<Term> ts ) {
    for( String s : gcd.vars() )
      for( Term t : ts )
        if( t.var(s) < gcd.var(s)-Util.EPS ) return false;
    for( FunKey k : gcd.funs() )
      for( Term t : ts )
        if( t.fun(k) < gcd.fun(k)-Util.EPS ) return false;
    return true;
  }

  // ------------------------------------------------------------------------
  /** Cancel same-argument exp powers across a fraction bar, repeating while
   *  anything changes. */
  public static @NotNull Expr simplifyExpInFraction( Expr e ) {
    Expr x = e;
    for( int i=0; i<Sym.MAX_CANCEL; i++ ) {
      Expr y = cancel_exp(x);
      if( y.equals(x) ) break;
      x = y;
    }
    return x;
  }

  private static Expr cancel_exp( Expr e ) {
    if( !(e instanceof Bin b) || b._op!=Op.DIV ) return e;
    ArrayList<Expr> nrest = new ArrayList<>(), drest = new ArrayList<>();
    LinkedHashMap<FunKey,Double> nexp = exps(b._l,nrest), dexp = exps(b._r,drest);
    boolean common = false;
    for( FunKey k : new ArrayList<>(nexp.keySet()) ) {
      Double dx = dexp.get(k);
      if( dx==null ) continue;
      common = true;
      double diff = nexp.get(k)-dx;
      if( Util.is_zero(diff) ) { nexp.remove(k); dexp.remove(k); }
      else if( diff > 0 ) { nexp.put(k,diff); dexp.remove(k); }
      else { nexp.remove(k); dexp.put(k,-diff); }
    }
    if( !common ) return e;
    nexp.forEach((k,p) -> nrest.add(exp_pow(k,p)));
    dexp.forEach((k,p) -> drest.add(exp_pow(k,p)));
    Expr x = Expr.div(Expr.product(nrest),Expr.product(drest));
    LOG.debug("exp cancelled: {} ==> {}",e,x);
    return x;
  }

  // Split the factors of one side into exp(a)^n powers, summed per argument,
  // and everything else.
  private static LinkedHashMap<FunKey,Double> exps( Expr side, List<Expr> rest ) {
    LinkedHashMap<FunKey,Double> exps = new LinkedHashMap<>();
    for( Expr f : Expr.factors(side) ) {
      if( f.is_fun("exp") ) exps.merge(FunKey.make((Fun)f),1.0,Double::sum);
      else if( f instanceof Bin p && p._op==Op.POW && p._l.is_fun("exp") && p._r instanceof Num n )
        exps.merge(FunKey.make((Fun)p._l),n._con,Double::sum);
      else rest.add(f);
    }
    return exps;
  }
  private static Expr exp_pow( FunKey k, double x ) {
    return Util.is_one(x) ? k.fun() : Expr.pow(k.fun(),x);
  }

  // ------------------------------------------------------------------------
  /** Cancel structurally equal factors between numerator and denominator,
   *  one for one.  An emptied side becomes 1; a denominator of 1 leaves the
   *  bare numerator. */
  public static @NotNull Expr reduceFraction( Expr e ) {
    if( !(e instanceof Bin b) || b._op!=Op.DIV ) return e;
    ArrayList<Expr> num = new ArrayList<>(Expr.factors(b._l));
    ArrayList<Expr> den = new ArrayList<>(Expr.factors(b._r));
    boolean progress = false;
    for( Iterator<Expr> it = num.iterator(); it.hasNext(); ) {
      if( den.remove(it.next()) ) { // Removes the first equal one
        it.remove();
        progress = true;
      }
    }
    if( !progress ) return e;
    Expr n = Expr.product(num), d = Expr.product(den);
    Expr x = d.is_num(1) ? n : Expr.div(n,d);
    LOG.debug("common factors cancelled: {} ==> {}",e,x);
    return x;
  }
}
