package com.cliffc.sym;

import com.cliffc.sym.Form.Kind;
import com.cliffc.sym.ast.Expr;
import com.cliffc.sym.ast.Op;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/** Run several simplification strategies over one input and collect the
 *  distinct results.
 *
 *  <p>Every rewrite step is guarded: a step that throws is logged, recorded
 *  as an {@link ErrMsg}, and leaves its input unchanged.  If the whole run
 *  fails the input itself is the only form.  One instance serves one call.
 */
public final class Strategies {
  private static final Logger LOG = LoggerFactory.getLogger(Strategies.class);

  private final ArrayList<ErrMsg> _errs = new ArrayList<>();
  Strategies() {}

  public static @NotNull Forms generateMultipleForms( Expr e ) { return new Strategies().run(e); }
  // The full pipeline to a fixed point
  public static @NotNull Expr iterativeSimplify( Expr e ) { return new Strategies().full(e); }

  private Forms run( Expr e ) {
    LOG.debug("strategies on {}",e);
    Forms forms = new Forms();
    try {
      forms.add_unique(expand  (e),Kind.EXPANDED  ,"expanded");
      forms.add_unique(trig    (e),Kind.STRUCTURAL,"trig simplified");
      forms.add_unique(factor  (e),Kind.FACTORED  ,"factored");
      forms.add_unique(fraction(e),Kind.FACTORED  ,"fraction reduced");
      forms.add_unique(full    (e),Kind.FACTORED  ,"fully simplified");
      // Pad with partial pipelines
      if( forms.size() < Sym.MIN_FORMS ) forms.add_unique(partial    (e),Kind.STRUCTURAL,"intermediate step");
      if( forms.size() < Sym.MIN_FORMS ) forms.add_unique(alternative(e),Kind.STRUCTURAL,"alternative form");
    } catch( RuntimeException ex ) {
      LOG.warn("simplification failed on {}, keeping it as-is",e,ex);
      forms = new Forms().add(e,Kind.STRUCTURAL,"original");
      _errs.add(ErrMsg.pipeline(e,ex));
    }
    for( ErrMsg err : _errs ) forms.err(err);
    LOG.debug("{} distinct forms, {} errors",forms.size(),_errs.size());
    return forms;
  }

  // Apply one step; on failure keep the pre-step value
  Expr step( String name, Expr x, UnaryOperator<Expr> fn ) {
    try {
      Expr y = fn.apply(x);
      if( LOG.isDebugEnabled() && !y.equals(x) ) LOG.debug("  {}: {}",name,y);
      return y;
    } catch( RuntimeException ex ) {
      LOG.warn("{} failed on {}: {}",name,x,ex.toString());
      _errs.add(ErrMsg.step(name,x,ex));
      return x;
    }
  }
  List<ErrMsg> errs() { return _errs; }

  // canonicalize, fold, drop zeros and ones, then optionally trig and
  // trivial powers
  private Expr round( Expr x, boolean trig, boolean pows ) {
    x = step("canonicalize",x,Canonicalizer::canonicalize);
    x = step("fold"        ,x,Passes::fold);
    x = step("drop zero"   ,x,Passes::dropZero);
    x = step("drop one"    ,x,Passes::dropOne);
    if( trig ) x = step("trig"  ,x,TrigRewriter::simplify);
    if( pows ) x = step("powers",x,Passes::simplifyPowers);
    return x;
  }

  private Expr fixed_point( Expr e, boolean trig, boolean pows ) {
    Expr x = e;
    for( int i=0; i<Sym.MAX_ROUNDS; i++ ) {
      Expr y = round(x,trig,pows);
      if( y.equals(x) ) return y;
      x = y;
    }
    LOG.debug("no fixed point after {} rounds: {}",Sym.MAX_ROUNDS,x);
    return x;
  }

  Expr expand( Expr e ) { return fixed_point(e,false,false); }
  Expr trig  ( Expr e ) { return fixed_point(e,true ,false); }
  Expr full  ( Expr e ) { return fixed_point(e,true ,true ); }

  // Canonical then trig, then the generator's factored form if it has one
  Expr factor( Expr e ) {
    Expr x = step("trig",step("canonicalize",e,Canonicalizer::canonicalize),TrigRewriter::simplify);
    Forms fs = generate(x);
    Form f = fs.find(x.is_op(Op.DIV) ? "numerator factored" : "factored");
    return f==null ? x : f._expr;
  }

  // Canonical then trig; a fraction takes the generator's last, most
  // cancelled, candidate
  Expr fraction( Expr e ) {
    Expr x = step("trig",step("canonicalize",e,Canonicalizer::canonicalize),TrigRewriter::simplify);
    return x.is_op(Op.DIV) ? generate(x).last()._expr : x;
  }

  private Forms generate( Expr x ) {
    Forms fs = FormGenerator.generateAllForms(x);
    _errs.addAll(fs.errs());
    return fs;
  }

  Expr partial( Expr e ) {
    Expr x = step("canonicalize",e,Canonicalizer::canonicalize);
    x = step("fold",x,Passes::fold);
    return step("trig",x,TrigRewriter::simplify);
  }

  Expr alternative( Expr e ) {
    Expr x = step("canonicalize",e,Canonicalizer::canonicalize);
    x = step("drop zero",x,Passes::dropZero);
    return step("drop one",x,Passes::dropOne);
  }
}
