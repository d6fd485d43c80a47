package com.cliffc.sym;

import com.cliffc.sym.ast.*;
import org.junit.Test;

import static com.cliffc.sym.Passes.*;
import static com.cliffc.sym.ast.Expr.*;
import static org.junit.Assert.*;

public class TestPasses {
  private static final Var X = Var.make("x"), Y = Var.make("y");

  @Test public void testFold() {
    assertEquals(num(14),fold(add(num(2),mul(num(3),num(4)))));
    assertEquals(num(0.5),fold(div(num(1),num(2))));
    assertEquals(num(8),fold(pow(num(2),num(3))));
    assertEquals("sin(2)+x",fold(add(fun("sin",add(num(1),num(1))),X)).toString());
    Expr d = div(num(1),num(0));
    assertEquals(d,fold(d));              // Division by zero stays
  }

  @Test public void testDropZero() {
    assertEquals(X,dropZero(add(num(0),X)));
    assertEquals(X,dropZero(add(X,num(0))));
    assertEquals(X,dropZero(sub(X,num(0))));
    assertEquals(Num.ZERO,dropZero(mul(X,num(0))));
    assertEquals(Y,dropZero(add(mul(num(0),X),Y))); // Bottom-up
    Expr e = sub(num(0),X);
    assertEquals(e,dropZero(e));
  }

  @Test public void testDropOne() {
    assertEquals(X,dropOne(mul(num(1),X)));
    assertEquals(X,dropOne(mul(X,num(1))));
    assertEquals(X,dropOne(div(X,num(1))));
    Expr e = div(num(1),X);
    assertEquals(e,dropOne(e));
  }

  @Test public void testPowers() {
    assertEquals(Num.ONE,simplifyPowers(pow(X,0)));
    assertEquals(X,simplifyPowers(pow(X,1)));
    assertEquals("x^2",simplifyPowers(pow(X,2)).toString());
  }

  @Test public void testNegation() {
    assertEquals(Num.ONE,negOne(mul(Num.NEG1,Num.NEG1)));
    assertEquals(mul(Num.NEG1,X),negOne(mul(X,Num.NEG1)));
    assertEquals(X,doubleNeg(mul(Num.NEG1,mul(Num.NEG1,X))));
  }

  @Test public void testClean() {
    assertEquals(X,clean(add(mul(mul(num(1),X),num(1)),num(0))));
    assertEquals(X,clean(mul(Num.NEG1,mul(X,Num.NEG1))));
    assertEquals("2*x",clean(mul(num(2),pow(X,num(1)))).toString());
  }
}
