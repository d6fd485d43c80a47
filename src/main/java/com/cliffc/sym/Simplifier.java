package com.cliffc.sym;

import com.cliffc.sym.ast.Expr;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** One-call entry points for a host application. */
public final class Simplifier {
  private static final Logger LOG = LoggerFactory.getLogger(Simplifier.class);
  private Simplifier() {}

  // All distinct simplified forms
  public static @NotNull Forms forms( Expr e ) { return Strategies.generateMultipleForms(check(e)); }

  // The simplified form cheapest to differentiate
  public static @NotNull Expr best( Expr e ) { return FormSelector.selectBestForm(forms(e))._expr; }

  // Tidy a raw tree (e.g. a derivative), canonicalize it, and pick the
  // cheapest of its factored forms.
  public static @NotNull Form prepare( Expr e ) {
    Expr x = Canonicalizer.canonicalize(Passes.clean(check(e)));
    Forms fs = FormGenerator.generateAllForms(x);
    Form f = FormSelector.selectBestForm(fs.display());
    LOG.debug("prepared {}: {} ({})",e,f,FormSelector.statistics(f._expr));
    return f;
  }

  // Canonical form only
  public static @NotNull Expr simplify( Expr e ) { return Canonicalizer.canonicalize(check(e)); }

  private static Expr check( Expr e ) {
    if( e==null ) throw new IllegalArgumentException("null expression");
    return e;
  }
}
