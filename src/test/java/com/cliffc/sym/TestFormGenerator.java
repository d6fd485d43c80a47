package com.cliffc.sym;

import com.cliffc.sym.ast.*;
import org.junit.Test;

import static com.cliffc.sym.Canonicalizer.canonicalize;
import static com.cliffc.sym.FormGenerator.*;
import static com.cliffc.sym.ast.Expr.*;
import static org.junit.Assert.*;

public class TestFormGenerator {
  private static final Var X = Var.make("x"), Y = Var.make("y"), Z = Var.make("z");
  private static Fun exp( Expr e ) { return fun("exp",e); }
  private static Fun sin( Expr e ) { return fun("sin",e); }
  private static Fun cos( Expr e ) { return fun("cos",e); }

  @Test public void testCommonFactor() {
    Expr s = canonicalize(add(mul(num(2),pow(X,2)),mul(num(4),X)));
    Expr f = extractCommonFactor(s);
    assertEquals(mul(mul(num(2),X),add(X,num(2))),f);
    assertEquals("2*x*(x+2)",f.toString());
    // Round trip
    assertEquals(s,canonicalize(f));

    Expr t = canonicalize(add(mul(num(6),mul(pow(X,3),Y)),mul(num(9),mul(pow(X,2),pow(Y,2)))));
    Expr g = extractCommonFactor(t);
    assertEquals("3*x^2*y*(3*y+2*x)",g.toString());
    assertEquals(t,canonicalize(g));
  }

  // Factoring then canonicalizing gives back the canonical sum
  private static Expr round_trip( Expr e ) {
    Expr s = canonicalize(e);
    Expr f = extractCommonFactor(s);
    assertNotEquals(s,f);
    assertEquals(e.toString(),s,canonicalize(f));
    return f;
  }

  @Test public void testRoundTrip() {
    // Negative exponents survive the division, and a negative least power is common
    assertEquals("2*x^-1*(x^2+1)",round_trip(add(mul(num(2),X),mul(num(2),pow(X,-1)))).toString());
    assertEquals("2*(2*x^-1+3)"  ,round_trip(add(mul(num(4),pow(X,-1)),num(6))).toString());
    assertEquals("sin(x)^-2*(y+sin(x)^3)",round_trip(add(pow(sin(X),1),mul(Y,pow(sin(X),-2)))).toString());
    // Fractional exponents
    assertEquals("x^0.5*(x+1)"   ,round_trip(add(pow(X,1.5),pow(X,0.5))).toString());
    round_trip(add(mul(num(3),pow(X,2.5)),mul(num(6),mul(pow(X,0.5),Y))));
    // Opaque nested factors ride along
    Expr f = round_trip(add(mul(X,pow(add(X,Y),0.5)),mul(num(2),X)));
    assertTrue(f.is_op(Op.MUL));
    round_trip(add(mul(num(4),mul(X,div(Y,Z))),mul(num(2),pow(X,2))));
  }

  @Test public void testNoCommonFactor() {
    Expr s = add(X,Y);
    assertSame(s,extractCommonFactor(s));
    Expr p = mul(num(2),X);
    assertSame(p,extractCommonFactor(p)); // Not a sum
    // A symbol missing from one summand is not common
    Expr q = add(mul(X,Y),Y);
    assertEquals("y*(x+1)",extractCommonFactor(q).toString());
    Expr r = add(mul(X,Y),Z);
    assertSame(r,extractCommonFactor(r));
  }

  @Test public void testFunctionPowers() {
    // sin(x)*sin(x)^2 is sin(x)^3 before the GCD is taken
    Expr s = add(mul(sin(X),pow(sin(X),2)),mul(pow(sin(X),3),Y));
    assertEquals("sin(x)^3*(1+y)",extractCommonFactor(s).toString());
    Expr t = sub(mul(num(4),X),num(6));
    Expr f = extractCommonFactor(t);
    assertTrue(f instanceof Bin b && b._op==Op.MUL && b._l.is_num(2));
  }

  @Test public void testExpCancel() {
    Expr e = div(mul(exp(X),sub(cos(X),sin(X))),pow(exp(X),2));
    assertEquals("(cos(x)-sin(x))/exp(x)",simplifyExpInFraction(e).toString());
    // Full cancellation leaves a 1
    assertEquals(div(Y,num(1)),simplifyExpInFraction(div(mul(exp(X),Y),exp(X))));
    // Surplus stays on top
    assertEquals("exp(x)^2/2",simplifyExpInFraction(div(pow(exp(X),3),mul(num(2),exp(X)))).toString());
    // Different arguments do not cancel
    Expr d = div(exp(X),exp(Y));
    assertSame(d,simplifyExpInFraction(d));
    assertSame(X,simplifyExpInFraction(X));
  }

  @Test public void testReduceFraction() {
    assertEquals("x/z",reduceFraction(div(mul(X,Y),mul(Y,Z))).toString());
    assertEquals(X,reduceFraction(div(mul(X,add(Y,num(1))),add(Y,num(1)))));
    assertEquals("1/z",reduceFraction(div(Y,mul(Y,Z))).toString());
    Expr d = div(X,Y);
    assertSame(d,reduceFraction(d));
  }

  @Test public void testAllFormsSum() {
    Expr s = canonicalize(add(mul(num(2),pow(X,2)),mul(num(4),X)));
    Forms fs = generateAllForms(s);
    assertEquals(2,fs.size());
    assertSame(s,fs.get(0)._expr);
    assertEquals("standard",fs.get(0)._label);
    assertEquals(Form.Kind.EXPANDED,fs.get(0)._kind);
    assertEquals("factored",fs.get(1)._label);
    assertEquals(Form.Kind.FACTORED,fs.get(1)._kind);
    assertEquals(1,generateAllForms(add(X,Y)).size());
    assertTrue(fs.errs().isEmpty());
  }

  @Test public void testAllFormsFraction() {
    Forms fs = generateAllForms(div(mul(exp(X),sub(cos(X),sin(X))),pow(exp(X),2)));
    assertEquals(2,fs.size());
    assertEquals("exp cancelled",fs.last()._label);
    assertEquals("(cos(x)-sin(x))/exp(x)",fs.last()._expr.toString());

    // (x^2+x)/(x+1): factor the numerator, then cancel x+1
    Forms gs = generateAllForms(canonicalize(div(add(pow(X,2),X),add(X,num(1)))));
    assertEquals(3,gs.size());
    assertEquals("numerator factored",gs.get(1)._label);
    assertEquals("x*(x+1)/(x+1)",gs.get(1)._expr.toString());
    assertEquals("common factors cancelled",gs.last()._label);
    assertEquals(Form.Kind.GROUPED,gs.last()._kind);
    assertEquals(X,gs.last()._expr);
  }
}
