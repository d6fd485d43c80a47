package com.cliffc.sym;

import com.cliffc.sym.ast.*;
import org.junit.Test;

import java.util.HashSet;

import static com.cliffc.sym.Strategies.generateMultipleForms;
import static com.cliffc.sym.ast.Expr.*;
import static org.junit.Assert.*;

public class TestStrategies {
  private static final Var X = Var.make("x");
  private static Fun sin( Expr e ) { return fun("sin",e); }
  private static Fun cos( Expr e ) { return fun("cos",e); }

  @Test public void testPolynomial() {
    // Every strategy agrees; padding finds nothing new either
    Forms fs = generateMultipleForms(pow(add(X,num(1)),2));
    assertEquals(1,fs.size());
    assertEquals("expanded",fs.get(0)._label);
    assertEquals(Form.Kind.EXPANDED,fs.get(0)._kind);
    assertEquals("x^2+2*x+1",fs.get(0)._expr.toString());
    assertTrue(fs.errs().isEmpty());
  }

  @Test public void testTrig() {
    Forms fs = generateMultipleForms(add(pow(sin(X),2),pow(cos(X),2)));
    assertEquals(2,fs.size());
    assertEquals("cos(x)^2+sin(x)^2",fs.get(0)._expr.toString());
    assertEquals("trig simplified",fs.get(1)._label);
    assertEquals(Num.ONE,fs.get(1)._expr);
  }

  @Test public void testFraction() {
    Forms fs = generateMultipleForms(div(add(pow(X,2),X),add(X,num(1))));
    assertEquals(3,fs.size());
    assertEquals("(x^2+x)/(x+1)",fs.get(0)._expr.toString());
    assertEquals("factored",fs.get(1)._label);
    assertEquals("x*(x+1)/(x+1)",fs.get(1)._expr.toString());
    assertEquals("fraction reduced",fs.get(2)._label);
    assertEquals(X,fs.get(2)._expr);
    // All distinct by rendering
    HashSet<String> seen = new HashSet<>();
    for( Form f : fs ) assertTrue(seen.add(f._expr.toString()));
  }

  @Test public void testIterative() {
    Expr e = add(mul(mul(num(2),sin(X)),cos(X)),pow(X,num(0)));
    assertEquals("sin(2*x)+1",Strategies.iterativeSimplify(e).toString());
  }

  @Test public void testStepDegrades() {
    Strategies s = new Strategies();
    Expr x = add(X,num(1));
    assertSame(x,s.step("boom",x,e -> { throw new IllegalStateException("boom"); }));
    assertEquals(1,s.errs().size());
    ErrMsg err = s.errs().get(0);
    assertEquals(ErrMsg.Level.StepFailed,err._lvl);
    assertEquals("boom",err._step);
    assertEquals("StepFailed in boom: boom on x+1",err.toString());
    // Later steps still run
    assertEquals("x+1",s.step("canonicalize",x,Canonicalizer::canonicalize).toString());
    assertEquals(1,s.errs().size());
  }

  @Test public void testPipelineFails() {
    // Nothing can be done with no tree at all; the input comes back alone
    Forms fs = generateMultipleForms(null);
    assertEquals(1,fs.size());
    assertEquals("original",fs.get(0)._label);
    assertEquals(Form.Kind.STRUCTURAL,fs.get(0)._kind);
    assertFalse(fs.errs().isEmpty());
    assertEquals(ErrMsg.Level.PipelineFailed,fs.errs().get(fs.errs().size()-1)._lvl);
  }
}
